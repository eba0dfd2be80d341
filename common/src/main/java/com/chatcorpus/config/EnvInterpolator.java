package com.chatcorpus.config;

import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${VAR}} and {@code ${VAR:default}} placeholders with environment values.
 *
 * <p>A placeholder without a default whose variable is unset is an error, so a missing
 * secret is reported at load time instead of surfacing as a failed provider call.</p>
 */
public class EnvInterpolator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::([^}]*))?}");

    private final UnaryOperator<String> lookup;

    public EnvInterpolator() {
        this(System::getenv);
    }

    public EnvInterpolator(UnaryOperator<String> lookup) {
        this.lookup = lookup;
    }

    public String interpolate(String text) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String fallback = matcher.group(2);
            String value = lookup.apply(name);
            if (value == null) {
                if (fallback == null) {
                    throw new IllegalArgumentException(
                            "Environment variable " + name + " is not set but referenced in config");
                }
                value = fallback;
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
