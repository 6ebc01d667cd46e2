package com.stratum.migration;

/** Thrown when a script identifier has no parseable leading version number. */
public class MalformedVersionException extends MigrationException {

    private final String identifier;

    public MalformedVersionException(String identifier, String reason) {
        super("Invalid migration filename '%s': %s".formatted(identifier, reason));
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
