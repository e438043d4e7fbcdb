package io.github.cyfko.texmath.core.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * TeX math styles together with the command that selects them.
 */
public enum MathStyle {
    DISPLAY("\\displaystyle"),
    TEXT("\\textstyle"),
    SCRIPT("\\scriptstyle"),
    SCRIPTSCRIPT("\\scriptscriptstyle");

    private final String command;

    MathStyle(String command) {
        this.command = command;
    }

    public String command() {
        return command;
    }

    public static Optional<MathStyle> fromCommand(String command) {
        return Arrays.stream(values()).filter(style -> style.command.equals(command)).findFirst();
    }
}
