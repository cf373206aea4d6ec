package com.queryscope.analyzer.stack;

import com.queryscope.analyzer.config.AnalyzerConfig.StackTraceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces the current call stack to the frames that belong to the
 * application issuing the command.
 *
 * A frame is dropped when it is generated code, belongs to this library, or
 * matches an excluded package. It is kept when it matches an application
 * package, was loaded from under the project root, or its class name carries
 * the project folder name. Lines are de-duplicated and capped.
 */
public final class StackTraceFilter {

    private static final Logger log = LoggerFactory.getLogger(StackTraceFilter.class);

    static final String LIBRARY_PREFIX = "com.queryscope.";
    private static final int MIN_ROOT_TOKEN_LENGTH = 3;
    private static final Pattern ANONYMOUS_CLASS = Pattern.compile("\\$\\d+(?:\\$|$)");

    private final StackCaptureProvider provider;
    private final Path projectRoot;
    private final String rootToken;
    private final List<String> applicationPackages;
    private final List<String> excludedPackages;
    private final boolean enabled;

    public StackTraceFilter(StackCaptureProvider provider, Path projectRoot,
                            List<String> applicationPackages, List<String> excludedPackages) {
        this(provider, projectRoot, applicationPackages, excludedPackages, true);
    }

    private StackTraceFilter(StackCaptureProvider provider, Path projectRoot,
                             List<String> applicationPackages, List<String> excludedPackages, boolean enabled) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.rootToken = rootToken(this.projectRoot);
        this.applicationPackages = List.copyOf(applicationPackages);
        this.excludedPackages = List.copyOf(excludedPackages);
        this.enabled = enabled;
    }

    /** Filter built from config; the project root is detected unless configured. */
    public static StackTraceFilter from(StackTraceConfig config, StackCaptureProvider provider) {
        if (!config.enabled()) {
            return disabled();
        }
        Path root = config.projectRoot().map(Path::of).orElseGet(ProjectRoot::detect);
        return new StackTraceFilter(provider, root, config.applicationPackages(), config.excludedPackages());
    }

    /** A filter that never captures. */
    public static StackTraceFilter disabled() {
        return new StackTraceFilter(List::of, Path.of(""), List.of(), List.of(), false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    /**
     * Capture and filter the current stack.
     *
     * @return formatted frames, innermost first; empty when nothing survives or capture fails
     */
    public List<String> capture(int maxLines) {
        if (!enabled || maxLines <= 0) {
            return List.of();
        }
        List<CapturedFrame> frames;
        try {
            frames = provider.capture();
        } catch (RuntimeException e) {
            log.debug("Stack capture failed", e);
            return List.of();
        }
        return filter(frames, maxLines);
    }

    List<String> filter(List<CapturedFrame> frames, int maxLines) {
        Set<String> lines = new LinkedHashSet<>();
        for (CapturedFrame frame : frames) {
            if (lines.size() >= maxLines) {
                break;
            }
            if (isApplicationFrame(frame)) {
                lines.add(format(frame));
            }
        }
        return lines.isEmpty() ? List.of() : List.copyOf(lines);
    }

    boolean isApplicationFrame(CapturedFrame frame) {
        String cls = frame.className();
        if (cls.startsWith(LIBRARY_PREFIX) || isGenerated(frame)) {
            return false;
        }
        if (startsWithAny(cls, applicationPackages)) {
            return true;
        }
        if (startsWithAny(cls, excludedPackages)) {
            return false;
        }
        return isUnderProjectRoot(frame) || containsRootToken(cls);
    }

    static boolean isGenerated(CapturedFrame frame) {
        String cls = frame.className();
        String method = frame.methodName();
        // $$Lambda, CGLIB $$EnhancerBy..., ByteBuddy/Hibernate proxies
        return cls.contains("$$")
            || cls.contains("$ByteBuddy$")
            || cls.contains("$HibernateProxy$")
            || cls.contains("GeneratedMethodAccessor")
            || method.startsWith("lambda$")
            || method.startsWith("access$")
            || method.equals("invokeSuspend")
            || ANONYMOUS_CLASS.matcher(cls).find();
    }

    private boolean isUnderProjectRoot(CapturedFrame frame) {
        if (!frame.hasLocation()) {
            return false;
        }
        try {
            return Path.of(frame.location()).toAbsolutePath().normalize().startsWith(projectRoot);
        } catch (RuntimeException e) {
            return false;
        }
    }

    private boolean containsRootToken(String className) {
        return rootToken != null && className.toLowerCase(Locale.ROOT).contains(rootToken);
    }

    String format(CapturedFrame frame) {
        StringBuilder sb = new StringBuilder()
            .append(frame.className()).append('.').append(frame.methodName()).append('(');
        if (frame.fileName() != null) {
            sb.append(frame.fileName());
            if (frame.lineNumber() >= 0) {
                sb.append(':').append(frame.lineNumber());
            }
        } else {
            sb.append("Unknown Source");
        }
        sb.append(')');
        if (isUnderProjectRoot(frame)) {
            Path relative = projectRoot.relativize(Path.of(frame.location()).toAbsolutePath().normalize());
            if (!relative.toString().isEmpty()) {
                sb.append(" in ").append(relative.toString().replace('\\', '/'));
            }
        }
        return sb.toString();
    }

    private static boolean startsWithAny(String className, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String rootToken(Path root) {
        Path name = root.getFileName();
        if (name == null) {
            return null;
        }
        String token = name.toString().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        return token.length() >= MIN_ROOT_TOKEN_LENGTH ? token : null;
    }
}
