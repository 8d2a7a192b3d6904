package com.phillippitts.branchplayer.service.flow;

/**
 * External success/failure choice controls.
 *
 * <p>The flow shows them only while a choice is pending and hides them whenever media plays.
 * Choices made on them reach the flow as queued signals.
 */
public interface ChoiceUi {

    void show();

    void hide();

    boolean isVisible();
}
