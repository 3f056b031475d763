/**
 * Bundled speech-to-text adapter running a local whisper.cpp binary.
 */
package com.phillippitts.voicegate.service.provider.whisper;
