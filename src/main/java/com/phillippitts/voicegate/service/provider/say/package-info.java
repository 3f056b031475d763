/**
 * Bundled text-to-speech adapter running a {@code say}-compatible command.
 */
package com.phillippitts.voicegate.service.provider.say;
