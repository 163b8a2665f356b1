package com.phillippitts.hugdimon.exception;

/**
 * Thrown when a dialog script is malformed: dangling transition targets, duplicate step ids,
 * missing entry step or no reachable terminal step. Raised while the script is loaded,
 * so a broken script stops the application at startup.
 */
public class DialogScriptException extends HugDimonException {

    private final String scriptName;

    public DialogScriptException(String scriptName, String message) {
        super("Dialog script '" + scriptName + "' is invalid: " + message);
        this.scriptName = scriptName;
    }

    public DialogScriptException(String scriptName, String message, Throwable cause) {
        super("Dialog script '" + scriptName + "' is invalid: " + message, cause);
        this.scriptName = scriptName;
    }

    public String getScriptName() {
        return scriptName;
    }
}
