package com.zzf.toolevents.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zzf.toolevents.bus.EventBus;
import com.zzf.toolevents.diff.TurnDiffTrackerFactory;
import com.zzf.toolevents.exec.ExecOutputFormatter;
import com.zzf.toolevents.parse.ShellCommandParser;
import com.zzf.toolevents.project.ProjectContext;
import com.zzf.toolevents.session.BusSessionFactory;
import com.zzf.toolevents.shell.ShellService;
import com.zzf.toolevents.tool.RejectionNormalizer;
import com.zzf.toolevents.tool.ToolEventDispatcher;
import com.zzf.toolevents.tool.ToolEventRunner;
import com.zzf.toolevents.tool.ToolOutcomeNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(ToolEventsProperties.class)
public class ToolEventsConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    @Bean
    public ExecOutputFormatter execOutputFormatter(ObjectMapper mapper, ToolEventsProperties props) {
        ToolEventsProperties.Output output = props.getOutput();
        log.info("toolevents.output maxBytes={} maxLines={}", output.getMaxBytes(), output.getMaxLines());
        return new ExecOutputFormatter(mapper, output.getMaxBytes(), output.getMaxLines());
    }

    @Bean
    public RejectionNormalizer rejectionNormalizer(ToolEventsProperties props) {
        return new RejectionNormalizer(props.getRejectionRewrites());
    }

    @Bean
    public ShellCommandParser shellCommandParser() {
        return new ShellCommandParser();
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public BusSessionFactory busSessionFactory(EventBus bus, ToolEventsProperties props) {
        return new BusSessionFactory(bus, props.getSession().getJournalSize());
    }

    @Bean
    public ToolEventDispatcher toolEventDispatcher(ExecOutputFormatter formatter) {
        return new ToolEventDispatcher(formatter);
    }

    @Bean
    public ToolOutcomeNormalizer toolOutcomeNormalizer(ToolEventDispatcher dispatcher, ExecOutputFormatter formatter,
                                                       RejectionNormalizer rejections, ToolEventsProperties props) {
        return new ToolOutcomeNormalizer(dispatcher, formatter, rejections, props.getAbortedMessage());
    }

    @Bean
    public ToolEventRunner toolEventRunner(ToolEventDispatcher dispatcher, ToolOutcomeNormalizer normalizer) {
        return new ToolEventRunner(dispatcher, normalizer);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectContext projectContext() {
        return new ProjectContext();
    }

    @Bean
    public ShellService shellService() {
        return new ShellService();
    }

    @Bean
    public TurnDiffTrackerFactory turnDiffTrackerFactory(ProjectContext projectContext, ShellService shellService,
                                                         ToolEventsProperties props) {
        return new TurnDiffTrackerFactory(projectContext, shellService, props.getSnapshot().getDir());
    }
}
