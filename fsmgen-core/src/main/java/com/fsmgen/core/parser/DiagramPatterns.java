package com.fsmgen.core.parser;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for the PlantUML state diagram subset understood by the parser.
 *
 * <p>All line patterns are applied with {@link java.util.regex.Matcher#matches()}, i.e. they
 * must cover the whole normalized line. Names are Unicode word characters, so {@code Grün} is a
 * valid state name.
 */
public final class DiagramPatterns {

    /** Prefixes of lines that are ignored wholesale. */
    public static final List<String> IGNORED_LINE_PREFIXES = List.of("@", "title ", "hide empty ", "note ");

    /** Color annotations such as {@code #lightblue}; removed from every line. */
    public static final Pattern COLOR_TAG = Pattern.compile("#\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    /** Start of an inline comment; the rest of the line is dropped. */
    public static final char COMMENT_QUOTE = '\'';

    /** Line closing a nested state block. */
    public static final String CLOSE_BRACE = "}";

    /** Escaped newline as written inside PlantUML labels. */
    public static final String ESCAPED_NEWLINE = "\\n";

    /** {@code [*] --> Name}; group 1 = target, group 2 = trailing text (must be empty). */
    public static final Pattern INITIAL_TRANSITION =
        Pattern.compile("\\[\\*\\]\\s+-{1,2}>\\s+(\\w+)\\s*(.*)", Pattern.UNICODE_CHARACTER_CLASS);

    /** {@code [state] Name [: clause] [{]}; group 2 = name, group 4 = clause, group 5 = brace. */
    public static final Pattern STATE_DECLARATION =
        Pattern.compile("(state\\s+)?(\\w+)\\s*(:\\s*(.*?)\\s*)?(\\{?)", Pattern.UNICODE_CHARACTER_CLASS);

    /** {@code From --> To [: clause]}; group 1 = from, group 2 = to, group 4 = clause. */
    public static final Pattern TRANSITION =
        Pattern.compile("(\\w+)\\s+-{1,2}>\\s(\\w+)\\s*(:\\s*(.*?)\\s*)?", Pattern.UNICODE_CHARACTER_CLASS);

    /** {@code event [ [guard] ] [ / action ... ]}; group 1 = event, group 3 = guard, group 5 = actions. */
    public static final Pattern TRANSITION_CLAUSE =
        Pattern.compile("(\\w+)\\s*(\\[\\s*(.*?)\\s*\\]\\s*)?(/(.*))?", Pattern.UNICODE_CHARACTER_CLASS);

    /** Separator between action statements. */
    public static final String ACTION_SEPARATOR = "/";

    private DiagramPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
