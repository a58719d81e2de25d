package ca.uwaterloo.swag.flowlens.util;

import java.util.logging.Level;

public enum MODE {
    DEBUG("debug"), EXECUTE("execute");

    private final Level logLevel;
    private final boolean dumpLineAnalysis;

    MODE(String mode) {
        if ("debug".equals(mode)) {
            this.logLevel = Level.FINE;
            this.dumpLineAnalysis = true;
        } else {
            this.logLevel = Level.INFO;
            this.dumpLineAnalysis = false;
        }
    }

    public Level logLevel() {
        return logLevel;
    }

    public boolean dumpLineAnalysis() {
        return dumpLineAnalysis;
    }
}
