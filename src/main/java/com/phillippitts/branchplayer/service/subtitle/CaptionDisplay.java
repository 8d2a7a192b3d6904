package com.phillippitts.branchplayer.service.subtitle;

/**
 * Surface that shows the current caption. An empty string clears it.
 */
public interface CaptionDisplay {

    void setText(String text);
}
