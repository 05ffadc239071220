package de.bsommerfeld.reviewinsights.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-facing preferences. Currently only the display language of the menu.
 */
public class UserConfig {

    @JsonProperty("language")
    private String language = "en";

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }
}
