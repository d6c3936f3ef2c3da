package org.prevoccupai.oh.processing.path;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import org.prevoccupai.oh.exception.ExtractionConfigurationException;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Glob matching of profile keys. Only {@code *} (any run of characters, possibly empty) is special; matching is
 * case-sensitive and covers the whole key, so {@code HR_*} is a prefix match, {@code *_timeline} a suffix match and
 * {@code *HAR*} a substring match.
 */
public class KeyPatterns {

    private static final String UNSUPPORTED_METACHARACTERS = "?[]";

    private static final LoadingCache<String, Pattern> COMPILED = CacheBuilder.newBuilder()
        .maximumSize(1_000)
        .build(CacheLoader.from(KeyPatterns::compile));

    private KeyPatterns() {
    }

    public static boolean matches(String key, String pattern) {
        validate(pattern);
        if (pattern.indexOf('*') < 0) {
            return pattern.equals(key);
        }
        return COMPILED.getUnchecked(pattern).matcher(key).matches();
    }

    /**
     * @return true if the key matches any of the patterns; false for a null or empty pattern collection
     */
    public static boolean matches(String key, Collection<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (matches(key, pattern)) {
                return true;
            }
        }
        return false;
    }

    public static List<String> include(List<String> keys, Collection<String> patterns) {
        return keys.stream().filter(key -> matches(key, patterns)).collect(Collectors.toList());
    }

    public static List<String> exclude(List<String> keys, Collection<String> patterns) {
        return keys.stream().filter(key -> !matches(key, patterns)).collect(Collectors.toList());
    }

    /**
     * Keeps keys matching an include pattern (all keys when {@code include} is null) and not matching any exclude
     * pattern. Exclusion wins when a key matches both.
     */
    public static List<String> select(List<String> keys, Collection<String> include, Collection<String> exclude) {
        List<String> included = include == null ? keys : include(keys, include);
        return exclude(included, exclude);
    }

    public static void validate(Collection<String> patterns) {
        patterns.forEach(KeyPatterns::validate);
    }

    public static void validate(String pattern) {
        if (pattern == null) {
            throw new ExtractionConfigurationException("Key pattern must not be null");
        }
        for (char c : UNSUPPORTED_METACHARACTERS.toCharArray()) {
            if (pattern.indexOf(c) >= 0) {
                throw new ExtractionConfigurationException(
                    "Unsupported glob syntax '" + c + "' in key pattern " + pattern + "; only '*' is recognised"
                );
            }
        }
    }

    private static Pattern compile(String glob) {
        return Pattern.compile(
            Arrays.stream(glob.split("\\*", -1)).map(Pattern::quote).collect(Collectors.joining(".*")),
            Pattern.DOTALL
        );
    }
}
