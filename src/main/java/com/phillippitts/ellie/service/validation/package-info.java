/**
 * Input validation for voice turns (emptiness, size ceiling, declared format).
 */
package com.phillippitts.ellie.service.validation;
