package com.spreadsheet.formula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the "spreadsheet.*" keys of application.properties.
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SpreadsheetProperties {

    // File the batch runner writes the rendered grid to
    private String outputFile = "output";

    // Minimum printed width of each cell
    private int columnWidth = 10;

    private int maxFractionDigits = 5;

    // Seed for random()/randbetween(); null means a fresh seed per process
    private Long randomSeed;

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public int getColumnWidth() {
        return columnWidth;
    }

    public void setColumnWidth(int columnWidth) {
        this.columnWidth = columnWidth;
    }

    public int getMaxFractionDigits() {
        return maxFractionDigits;
    }

    public void setMaxFractionDigits(int maxFractionDigits) {
        this.maxFractionDigits = maxFractionDigits;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }
}
