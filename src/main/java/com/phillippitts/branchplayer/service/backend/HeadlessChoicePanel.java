package com.phillippitts.branchplayer.service.backend;

import com.phillippitts.branchplayer.service.flow.ChoiceUi;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Choice controls without a screen; the REST API plays the role of the buttons and checks
 * {@link #isVisible()} before accepting a choice.
 */
public class HeadlessChoicePanel implements ChoiceUi {

    private static final Logger LOG = LogManager.getLogger(HeadlessChoicePanel.class);

    private volatile boolean visible;

    @Override
    public void show() {
        if (!visible) {
            visible = true;
            LOG.info("Choice panel shown: POST /api/flow/choice/{success|failure}");
        }
    }

    @Override
    public void hide() {
        if (visible) {
            visible = false;
            LOG.debug("Choice panel hidden");
        }
    }

    @Override
    public boolean isVisible() {
        return visible;
    }
}
