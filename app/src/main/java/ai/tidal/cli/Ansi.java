package ai.tidal.cli;

public final class Ansi {
    private static final String RESET = "\u001b[0m";
    private static final String DIM = "\u001b[2m";
    private static final String RED = "\u001b[31m";
    private static final String YELLOW = "\u001b[33m";

    private Ansi() {}

    public static String dim(String text, boolean enabled) {
        return style(DIM, text, enabled);
    }

    public static String red(String text, boolean enabled) {
        return style(RED, text, enabled);
    }

    public static String yellow(String text, boolean enabled) {
        return style(YELLOW, text, enabled);
    }

    private static String style(String code, String text, boolean enabled) {
        return enabled && !text.isEmpty() ? code + text + RESET : text;
    }
}
