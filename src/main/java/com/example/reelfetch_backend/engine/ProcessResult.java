package com.example.reelfetch_backend.engine;

/** Outcome of one external tool run; {@code code} is -1 when the run timed out. */
record ProcessResult(int code, String output, boolean timedOut) { }
