/**
 * HTTP boundary: operational controllers and exception mapping. Presentation depends on services,
 * never the reverse.
 */
package com.phillippitts.voicegate.presentation;
