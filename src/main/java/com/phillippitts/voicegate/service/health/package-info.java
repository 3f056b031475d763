/**
 * Background provider probing and the actuator health indicator.
 */
package com.phillippitts.voicegate.service.health;
