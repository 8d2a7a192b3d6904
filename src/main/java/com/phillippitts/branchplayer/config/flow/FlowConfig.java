package com.phillippitts.branchplayer.config.flow;

import com.phillippitts.branchplayer.config.properties.FlowProperties;
import com.phillippitts.branchplayer.domain.QuestionSequence;
import com.phillippitts.branchplayer.service.caption.CaptionLoader;
import com.phillippitts.branchplayer.service.caption.CaptionParser;
import com.phillippitts.branchplayer.service.caption.ResourceCaptionLoader;
import com.phillippitts.branchplayer.service.caption.SrtCaptionParser;
import com.phillippitts.branchplayer.service.flow.ChoiceUi;
import com.phillippitts.branchplayer.service.flow.FlowRunner;
import com.phillippitts.branchplayer.service.flow.FlowStateMachine;
import com.phillippitts.branchplayer.service.metrics.PlaybackMetrics;
import com.phillippitts.branchplayer.service.playback.AudioBackend;
import com.phillippitts.branchplayer.service.playback.MediaClock;
import com.phillippitts.branchplayer.service.playback.PlaybackSession;
import com.phillippitts.branchplayer.service.playback.VideoBackend;
import com.phillippitts.branchplayer.service.signal.SignalQueue;
import com.phillippitts.branchplayer.service.subtitle.CaptionDisplay;
import com.phillippitts.branchplayer.service.subtitle.SubtitleDriver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the caption engine, playback session, state machine and tick loop.
 * Backends, caption display and choice UI come from a backend configuration.
 */
@Configuration
public class FlowConfig {

    private final FlowProperties flowProperties;
    private final PlaybackMetrics metrics;

    public FlowConfig(FlowProperties flowProperties, PlaybackMetrics metrics) {
        this.flowProperties = flowProperties;
        this.metrics = metrics;
    }

    @Bean
    public QuestionSequence questionSequence() {
        return flowProperties.toSequence();
    }

    @Bean
    public SignalQueue signalQueue() {
        return new SignalQueue();
    }

    @Bean
    public CaptionParser captionParser() {
        return new SrtCaptionParser();
    }

    @Bean
    public CaptionLoader captionLoader(ResourceLoader resourceLoader) {
        return new ResourceCaptionLoader(resourceLoader);
    }

    /**
     * Caption clock: narration track while it plays, video otherwise.
     */
    @Bean
    public MediaClock mediaClock(VideoBackend videoBackend,
                                 @Qualifier("narrationAudioBackend") AudioBackend narration) {
        return new MediaClock(videoBackend, narration);
    }

    @Bean
    public SubtitleDriver subtitleDriver(CaptionDisplay captionDisplay, MediaClock mediaClock) {
        return new SubtitleDriver(captionDisplay, mediaClock,
                flowProperties.getTimeOffsetSeconds(), flowProperties.isClearCaptionsInGaps());
    }

    @Bean
    public PlaybackSession playbackSession(VideoBackend videoBackend,
                                           @Qualifier("narrationAudioBackend") AudioBackend narration,
                                           @Qualifier("musicAudioBackend") AudioBackend music,
                                           SubtitleDriver subtitleDriver,
                                           CaptionLoader captionLoader,
                                           CaptionParser captionParser,
                                           SignalQueue signalQueue) {
        return new PlaybackSession(videoBackend, narration, music, subtitleDriver,
                captionLoader, captionParser, signalQueue, metrics);
    }

    @Bean
    public FlowStateMachine flowStateMachine(QuestionSequence questionSequence,
                                             PlaybackSession playbackSession,
                                             ChoiceUi choiceUi,
                                             ApplicationEventPublisher publisher) {
        return new FlowStateMachine(questionSequence, playbackSession, choiceUi, publisher, metrics);
    }

    @Bean
    public FlowRunner flowRunner(SignalQueue signalQueue,
                                 FlowStateMachine flowStateMachine,
                                 PlaybackSession playbackSession,
                                 SubtitleDriver subtitleDriver) {
        return new FlowRunner(signalQueue, flowStateMachine, playbackSession, subtitleDriver,
                flowProperties.isAutoStart());
    }
}
