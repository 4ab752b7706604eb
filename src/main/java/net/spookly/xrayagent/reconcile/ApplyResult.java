package net.spookly.xrayagent.reconcile;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.xrayagent.model.Command;

/**
 * Outcome of a successful apply. {@code changed} is false when the command was already in effect.
 */
@Value
@Accessors(fluent = true)
public class ApplyResult {
    Command command;
    boolean changed;
    int usersCount;
}
