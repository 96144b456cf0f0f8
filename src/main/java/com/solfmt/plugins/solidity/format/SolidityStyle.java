package com.solfmt.plugins.solidity.format;

import com.solfmt.config.FormatterConfig;

/**
 * Immutable style settings for one formatting run.
 */
public final class SolidityStyle {
    public static final String PLUGIN = "solidity";
    public static final int DEFAULT_LINE_LENGTH = 80;
    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final SolidityStyle DEFAULT = builder().build();

    private final int lineLength;
    private final int tabWidth;
    private final boolean bracketSpacing;

    private SolidityStyle(Builder builder) {
        if (builder.lineLength <= 0) {
            throw new IllegalArgumentException("lineLength must be positive: " + builder.lineLength);
        }
        if (builder.tabWidth <= 0) {
            throw new IllegalArgumentException("tabWidth must be positive: " + builder.tabWidth);
        }
        this.lineLength = builder.lineLength;
        this.tabWidth = builder.tabWidth;
        this.bracketSpacing = builder.bracketSpacing;
    }

    /**
     * Reads the style from the {@code solidity} plugin section, falling back to the general
     * {@code lineLength} and {@code tabWidth}.
     */
    public static SolidityStyle fromConfig(FormatterConfig config) {
        int lineLength = config.getGeneralConfig("lineLength", DEFAULT_LINE_LENGTH);
        int tabWidth = config.getGeneralConfig("tabWidth", DEFAULT_TAB_WIDTH);
        return builder()
                .lineLength(config.getPluginConfig(PLUGIN, "lineLength", lineLength))
                .tabWidth(config.getPluginConfig(PLUGIN, "tabWidth", tabWidth))
                .bracketSpacing(config.getPluginConfig(PLUGIN, "bracketSpacing", false))
                .build();
    }

    /** Soft maximum width before a list is laid out one item per line. */
    public int getLineLength() {
        return lineLength;
    }

    /** Spaces per indentation level. */
    public int getTabWidth() {
        return tabWidth;
    }

    public String openingBracket() {
        return bracketSpacing ? "{ " : "{";
    }

    public String closingBracket() {
        return bracketSpacing ? " }" : "}";
    }

    public String emptyBrackets() {
        return bracketSpacing ? "{ }" : "{}";
    }

    @Override
    public String toString() {
        return "SolidityStyle{lineLength=" + lineLength + ", tabWidth=" + tabWidth
                + ", bracketSpacing=" + bracketSpacing + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int lineLength = DEFAULT_LINE_LENGTH;
        private int tabWidth = DEFAULT_TAB_WIDTH;
        private boolean bracketSpacing;

        public Builder lineLength(int lineLength) {
            this.lineLength = lineLength;
            return this;
        }

        public Builder tabWidth(int tabWidth) {
            this.tabWidth = tabWidth;
            return this;
        }

        public Builder bracketSpacing(boolean bracketSpacing) {
            this.bracketSpacing = bracketSpacing;
            return this;
        }

        public SolidityStyle build() {
            return new SolidityStyle(this);
        }
    }
}
