package pl.marcinmilkowski.deriv_lexicon.traversal;

import java.util.Locale;

/**
 * Connector glyphs used by {@link SubtreePrinter}.
 */
public enum RenderStyle {
    /** Box-drawing characters. */
    UNICODE("├─", "└─", "│ ", "  "),
    /** Plain ASCII for terminals without box-drawing glyphs. */
    ASCII("|-", "`-", "| ", "  ");

    private final String branch;
    private final String lastBranch;
    private final String rail;
    private final String blank;

    RenderStyle(String branch, String lastBranch, String rail, String blank) {
        this.branch = branch;
        this.lastBranch = lastBranch;
        this.rail = rail;
        this.blank = blank;
    }

    public String branch() { return branch; }
    public String lastBranch() { return lastBranch; }
    public String rail() { return rail; }
    public String blank() { return blank; }

    public static RenderStyle parse(String name) {
        if (name == null || name.isBlank()) {
            return UNICODE;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "unicode":
                return UNICODE;
            case "ascii":
                return ASCII;
            default:
                throw new IllegalArgumentException("Unknown render style: " + name + " (expected unicode or ascii)");
        }
    }
}
