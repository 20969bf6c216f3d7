package com.demoBank.advisor.router.model;

/**
 * A lexical correction of the extracted intent.
 */
public record IntentOverride(IntentName intent, String name) {

    public String reasonCode() {
        return "intent_override:" + name;
    }
}
