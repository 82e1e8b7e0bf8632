package com.ewas.alerting.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AlertTemplate - title/text with {placeholder} substitution, selected by category
 * and optionally by detector type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "alert_templates")
public class AlertTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z0-9_.]+)}");

    @Id
    private String id;

    private String name;
    private String category;

    /**
     * Blank or null matches every detector type.
     */
    private String detectorType;

    private String title;
    private String text;

    @Builder.Default
    private boolean active = true;

    public String renderTitle(Map<String, Object> context) {
        return render(title, context);
    }

    public String renderText(Map<String, Object> context) {
        return render(text, context);
    }

    /**
     * Unknown placeholders render as empty strings.
     */
    static String render(String source, Map<String, Object> context) {
        if (source == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(source);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object value = context.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : value.toString()));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
