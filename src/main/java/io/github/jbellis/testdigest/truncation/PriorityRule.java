package io.github.jbellis.testdigest.truncation;

import org.jetbrains.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Raises content to {@code priority} when {@code pattern} is found in it.
 *
 * @param contentType when set, the rule only applies to this content type
 */
public record PriorityRule(Pattern pattern,
                           ContentPriority priority,
                           @Nullable ContentType contentType,
                           String description) {

    public boolean appliesTo(ContentType type) {
        return contentType == null || contentType == type;
    }

    public boolean matches(String content) {
        return pattern.matcher(content).find();
    }
}
