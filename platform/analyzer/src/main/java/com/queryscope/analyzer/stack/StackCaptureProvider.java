package com.queryscope.analyzer.stack;

import java.util.List;

/**
 * Source of the current thread's call stack, innermost frame first.
 */
@FunctionalInterface
public interface StackCaptureProvider {

    List<CapturedFrame> capture();
}
