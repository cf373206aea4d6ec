package com.queryscope.analyzer.stack;

import com.queryscope.platform.base.Result;

import java.net.URL;
import java.nio.file.Path;
import java.security.CodeSource;
import java.security.ProtectionDomain;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Captures frames with {@link StackWalker}, resolving each declaring class
 * to the jar or directory it was loaded from.
 */
public final class StackWalkerCaptureProvider implements StackCaptureProvider {

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private static final ClassValue<String> LOCATIONS = new ClassValue<>() {
        @Override
        protected String computeValue(Class<?> type) {
            return locate(type);
        }
    };

    @Override
    public List<CapturedFrame> capture() {
        return WALKER.walk(frames -> frames
            .map(f -> new CapturedFrame(
                f.getClassName(),
                f.getMethodName(),
                f.getFileName(),
                f.getLineNumber(),
                LOCATIONS.get(f.getDeclaringClass())))
            .collect(Collectors.toList()));
    }

    // JDK classes and classes from non-file code sources have no usable location
    private static String locate(Class<?> type) {
        return Result.of(() -> {
            ProtectionDomain domain = type.getProtectionDomain();
            CodeSource source = domain == null ? null : domain.getCodeSource();
            URL url = source == null ? null : source.getLocation();
            if (url == null || !"file".equals(url.getProtocol())) {
                return "";
            }
            return Path.of(url.toURI()).toAbsolutePath().normalize().toString();
        }).getOrElse("");
    }
}
