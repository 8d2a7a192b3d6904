package com.phillippitts.branchplayer.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionSetTest {

    private final QuestionSet set = new QuestionSet(
            new PhaseMedia("q.mp4", "q.mp3", "theme.mp3", "q.srt"),
            PhaseMedia.ofVideo("ok.mp4"),
            PhaseMedia.ofVideo("retry.mp4"));

    @Test
    void selectsMediaByPhase() {
        assertThat(set.media(Phase.QUESTION).video()).isEqualTo("q.mp4");
        assertThat(set.media(Phase.OUTCOME_SUCCESS).video()).isEqualTo("ok.mp4");
        assertThat(set.media(Phase.OUTCOME_FAILURE).video()).isEqualTo("retry.mp4");
    }

    @Test
    void buildsBundleForPhaseAndIndex() {
        MediaBundle bundle = set.bundle(3, Phase.QUESTION);

        assertThat(bundle.phase()).isEqualTo(Phase.QUESTION);
        assertThat(bundle.questionIndex()).isEqualTo(3);
        assertThat(bundle.video()).isEqualTo("q.mp4");
        assertThat(bundle.narration()).isEqualTo("q.mp3");
        assertThat(bundle.music()).isEqualTo("theme.mp3");
        assertThat(bundle.captions()).isEqualTo("q.srt");
        assertThat(bundle.describe()).isEqualTo("QUESTION#3");
    }

    @Test
    void missingPhasesBecomeEmptyMedia() {
        QuestionSet partial = new QuestionSet(PhaseMedia.ofVideo("q.mp4"), null, null);

        assertThat(partial.media(Phase.OUTCOME_SUCCESS)).isEqualTo(PhaseMedia.EMPTY);
        assertThat(partial.bundle(0, Phase.OUTCOME_FAILURE).video()).isNull();
    }

    @Test
    void blankReferencesAreTreatedAsAbsent() {
        PhaseMedia media = new PhaseMedia("  ", "", " a.mp3 ", null);

        assertThat(media.hasVideo()).isFalse();
        assertThat(media.narration()).isNull();
        assertThat(media.music()).isEqualTo("a.mp3");
    }

    @Test
    void bundleRejectsNegativeIndex() {
        assertThatThrownBy(() -> new MediaBundle(Phase.QUESTION, -1, PhaseMedia.EMPTY))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
