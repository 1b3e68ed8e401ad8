/**
 * REST boundary of the recorder: the control controller and the exception-to-HTTP mapping.
 * Presentation depends on services, never the reverse.
 */
package com.phillippitts.clipcast.presentation;
