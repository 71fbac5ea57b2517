package com.eyelevel.paperprocessor.service.latex;

import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Lossy LaTeX-to-plain-text conversion built from a fixed sequence of regular expressions.
 * <p>
 * Math is replaced by {@value #INLINE_MATH} or {@value #DISPLAY_MATH}, single-argument commands by their
 * argument (one shallow pass) and environment markers are dropped while their content is kept. The output is
 * meant for indexing and previews, not for faithful rendering.
 */
@Service
public class LatexTextExtractor {

    static final String INLINE_MATH = "[MATH]";
    static final String DISPLAY_MATH = "[EQUATION]";

    private static final String INLINE_REPLACEMENT = " " + INLINE_MATH + " ";
    private static final String DISPLAY_REPLACEMENT = " " + DISPLAY_MATH + " ";

    private static final Pattern COMMENT = Pattern.compile("(?<!\\\\)%.*$", Pattern.MULTILINE);
    private static final Pattern MATH_ENVIRONMENT = Pattern.compile(
            "\\\\begin\\{(equation|align|gather|multline|eqnarray)(\\*?)\\}.*?\\\\end\\{\\1\\2\\}", Pattern.DOTALL);
    private static final Pattern DISPLAY_DOLLARS = Pattern.compile("(?<!\\\\)\\$\\$.+?\\$\\$", Pattern.DOTALL);
    private static final Pattern DISPLAY_BRACKETS = Pattern.compile("(?<!\\\\)\\\\\\[.+?\\\\\\]", Pattern.DOTALL);
    private static final Pattern INLINE_DOLLAR = Pattern.compile("(?<!\\\\)\\$.+?(?<!\\\\)\\$", Pattern.DOTALL);
    private static final Pattern INLINE_PARENS = Pattern.compile("(?<!\\\\)\\\\\\(.+?\\\\\\)", Pattern.DOTALL);
    private static final Pattern ENVIRONMENT_MARKER = Pattern.compile("\\\\(?:begin|end)\\{[^}]*\\}(?:\\[[^\\]]*\\])?");
    private static final Pattern COMMAND_WITH_ARGUMENT = Pattern.compile("\\\\[A-Za-z]+\\*?(?:\\[[^\\]]*\\])?\\{([^{}]*)\\}");
    private static final Pattern LINE_BREAK = Pattern.compile("\\\\\\\\");
    private static final Pattern BARE_COMMAND = Pattern.compile("\\\\[A-Za-z]+\\*?");
    private static final Pattern BRACE = Pattern.compile("(?<!\\\\)[{}]");
    private static final Pattern ESCAPED_CHARACTER = Pattern.compile("\\\\([%$&#_{}])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @param source LaTeX source; {@code null} is treated as empty.
     * @return The extracted text, never {@code null}.
     */
    public String toText(final String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        String text = COMMENT.matcher(source).replaceAll("");
        text = MATH_ENVIRONMENT.matcher(text).replaceAll(DISPLAY_REPLACEMENT);
        text = DISPLAY_DOLLARS.matcher(text).replaceAll(DISPLAY_REPLACEMENT);
        text = DISPLAY_BRACKETS.matcher(text).replaceAll(DISPLAY_REPLACEMENT);
        text = INLINE_DOLLAR.matcher(text).replaceAll(INLINE_REPLACEMENT);
        text = INLINE_PARENS.matcher(text).replaceAll(INLINE_REPLACEMENT);
        text = ENVIRONMENT_MARKER.matcher(text).replaceAll(" ");
        text = COMMAND_WITH_ARGUMENT.matcher(text).replaceAll("$1");
        text = LINE_BREAK.matcher(text).replaceAll(" ");
        text = BARE_COMMAND.matcher(text).replaceAll(" ");
        text = BRACE.matcher(text).replaceAll("");
        text = ESCAPED_CHARACTER.matcher(text).replaceAll("$1");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
