package com.phillippitts.branchplayer.config.backend;

import com.phillippitts.branchplayer.config.properties.SimulatedBackendProperties;
import com.phillippitts.branchplayer.service.backend.HeadlessChoicePanel;
import com.phillippitts.branchplayer.service.backend.LoggingCaptionDisplay;
import com.phillippitts.branchplayer.service.backend.SimulatedAudioBackend;
import com.phillippitts.branchplayer.service.backend.SimulatedVideoBackend;
import com.phillippitts.branchplayer.service.flow.ChoiceUi;
import com.phillippitts.branchplayer.service.playback.AudioBackend;
import com.phillippitts.branchplayer.service.playback.VideoBackend;
import com.phillippitts.branchplayer.service.subtitle.CaptionDisplay;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Headless collaborators. Active when backend.type is simulated or missing.
 */
@Configuration
@ConditionalOnProperty(prefix = "backend", name = "type", havingValue = "simulated", matchIfMissing = true)
public class SimulatedBackendConfig {

    private final SimulatedBackendProperties props;

    public SimulatedBackendConfig(SimulatedBackendProperties props) {
        this.props = props;
    }

    @Bean
    public VideoBackend videoBackend() {
        return new SimulatedVideoBackend(props.getClipDurationSeconds(), props.getPrepareDelayMs());
    }

    @Bean
    public AudioBackend narrationAudioBackend() {
        return new SimulatedAudioBackend("narration");
    }

    @Bean
    public AudioBackend musicAudioBackend() {
        return new SimulatedAudioBackend("music");
    }

    @Bean
    public CaptionDisplay captionDisplay() {
        return new LoggingCaptionDisplay();
    }

    @Bean
    public ChoiceUi choiceUi() {
        return new HeadlessChoicePanel();
    }
}
