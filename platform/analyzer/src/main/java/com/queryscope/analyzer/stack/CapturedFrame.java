package com.queryscope.analyzer.stack;

import java.util.Objects;

/**
 * One call-stack frame as seen by the filter.
 *
 * @param className  fully qualified declaring class
 * @param methodName method name
 * @param fileName   source file, or null when unknown
 * @param lineNumber source line, or a negative value when unknown
 * @param location   code-source location of the declaring class (jar or class directory), "" when unknown
 */
public record CapturedFrame(String className, String methodName, String fileName, int lineNumber, String location) {

    public CapturedFrame {
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(methodName, "methodName");
        location = location == null ? "" : location;
    }

    public static CapturedFrame of(String className, String methodName, String fileName, int lineNumber) {
        return new CapturedFrame(className, methodName, fileName, lineNumber, "");
    }

    public boolean hasLocation() {
        return !location.isEmpty();
    }
}
