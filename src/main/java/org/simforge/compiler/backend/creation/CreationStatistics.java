package org.simforge.compiler.backend.creation;

/**
 * Counters of one creation run.
 */
public final class CreationStatistics {

    private int objectsCreated;
    private int connectionsCreated;
    private int materialUnitsCreated;
    private int errors;
    private int warnings;

    void objectCreated() {
        objectsCreated++;
    }

    void connectionCreated() {
        connectionsCreated++;
    }

    void materialUnitCreated() {
        materialUnitsCreated++;
    }

    void error() {
        errors++;
    }

    void warning() {
        warnings++;
    }

    public int objectsCreated() {
        return objectsCreated;
    }

    public int connectionsCreated() {
        return connectionsCreated;
    }

    public int materialUnitsCreated() {
        return materialUnitsCreated;
    }

    public int errors() {
        return errors;
    }

    public int warnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return String.format("objects=%d, connections=%d, materialUnits=%d, errors=%d, warnings=%d",
                objectsCreated, connectionsCreated, materialUnitsCreated, errors, warnings);
    }
}
