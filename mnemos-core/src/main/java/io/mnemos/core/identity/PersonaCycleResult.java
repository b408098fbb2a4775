package io.mnemos.core.identity;

public record PersonaCycleResult(PersonaFocus focus, boolean completed, PersonaUpdates updates, String error) {

    public static PersonaCycleResult completed(PersonaFocus focus, PersonaUpdates updates) {
        return new PersonaCycleResult(focus, true, updates, null);
    }

    public static PersonaCycleResult failed(PersonaFocus focus, String error) {
        return new PersonaCycleResult(focus, false, PersonaUpdates.empty(), error);
    }
}
