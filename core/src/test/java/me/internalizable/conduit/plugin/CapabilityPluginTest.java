package me.internalizable.conduit.plugin;

import me.internalizable.conduit.api.chat.InboundCallback;
import me.internalizable.conduit.api.chat.InboundMessage;
import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;
import me.internalizable.conduit.api.event.HandlerResult;
import me.internalizable.conduit.api.event.types.AIResponseEvent;
import me.internalizable.conduit.api.event.types.CallbackQueryEvent;
import me.internalizable.conduit.api.event.types.MessageReceivedEvent;
import me.internalizable.conduit.api.plugin.PluginMetadata;
import me.internalizable.conduit.api.plugin.capability.AIPlugin;
import me.internalizable.conduit.api.plugin.capability.CallbackPlugin;
import me.internalizable.conduit.api.plugin.capability.MessagePlugin;
import me.internalizable.conduit.api.plugin.capability.MessagePluginHandler;
import me.internalizable.conduit.config.ConduitConfig;
import me.internalizable.conduit.event.ConduitEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CapabilityPluginTest {

    @Mock
    private InboundMessage message;

    @Mock
    private InboundCallback callback;

    private ConduitEventBus eventBus;
    private ConduitPluginManager pluginManager;

    @BeforeEach
    void setUp() {
        ConduitConfig config = new ConduitConfig();
        config.setDispatchThreads(2);
        config.setShutdownTimeoutSeconds(1);
        eventBus = new ConduitEventBus(config);
        pluginManager = new ConduitPluginManager(eventBus);
    }

    @AfterEach
    void tearDown() {
        eventBus.shutdown();
    }

    private static final class EchoPlugin extends MessagePlugin {

        private final String reply;
        private final boolean accept;

        EchoPlugin(String reply, boolean accept) {
            this.reply = reply;
            this.accept = accept;
        }

        @Override
        public PluginMetadata getMetadata() {
            return PluginMetadata.builder("echo").build();
        }

        @Override
        public String processMessage(InboundMessage message, MessageReceivedEvent event) {
            return reply == null ? null : reply + event.getText();
        }

        @Override
        public boolean shouldProcess(InboundMessage message) {
            return accept;
        }
    }

    private static final class LocalePlugin extends MessagePlugin {

        final List<Throwable> errors = new CopyOnWriteArrayList<>();

        volatile RuntimeException failure;

        @Override
        public PluginMetadata getMetadata() {
            return PluginMetadata.builder("locale").build();
        }

        @Override
        public String processMessage(InboundMessage message, MessageReceivedEvent event) {
            if (failure != null) {
                throw failure;
            }
            return "locale: " + event.getMetadata().get("locale");
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
        }
    }

    private static final class ConfirmPlugin extends CallbackPlugin {

        @Override
        public PluginMetadata getMetadata() {
            return PluginMetadata.builder("confirm").build();
        }

        @Override
        public String processCallback(InboundCallback callback, CallbackQueryEvent event) {
            return "confirm:task".equals(event.getCallbackData()) ? "Task confirmed" : "";
        }
    }

    private static final class TokenCounterPlugin extends AIPlugin {

        @Override
        public PluginMetadata getMetadata() {
            return PluginMetadata.builder("token-counter").build();
        }

        @Override
        public Map<String, Object> processAIResponse(String response, AIResponseEvent event) {
            return Map.of("length", response.length(), "model", event.getModel());
        }
    }

    // ==================== Message ====================

    @Test
    void messagePluginRepliesToMessages() throws Exception {
        // given
        when(message.getText()).thenReturn("hello");
        pluginManager.loadPlugin(new EchoPlugin("echo: ", true));

        // when
        List<HandlerResult> results = eventBus.publishAndWait(new MessageReceivedEvent(message, 7L, 42L));

        // then
        assertThat(results).extracting(HandlerResult::getValue).containsExactly("echo: hello");
        verify(message).reply("echo: hello");
    }

    @Test
    void messagePluginSkipsRejectedMessages() throws Exception {
        pluginManager.loadPlugin(new EchoPlugin("echo: ", false));

        List<HandlerResult> results = eventBus.publishAndWait(new MessageReceivedEvent(message, 7L, 42L));

        assertThat(results).singleElement().extracting(HandlerResult::getValue).isNull();
        verify(message, never()).reply(anyString());
    }

    @Test
    void messagePluginDoesNotSendEmptyReplies() throws Exception {
        pluginManager.loadPlugin(new EchoPlugin(null, true));

        eventBus.publishAndWait(new MessageReceivedEvent(message, 7L, 42L));

        verify(message, never()).reply(anyString());
    }

    @Test
    void adapterIgnoresEventsOfOtherClasses() {
        pluginManager.loadPlugin(new EchoPlugin("echo: ", true));

        List<HandlerResult> results = eventBus.publishAndWait(Event.builder(MessageReceivedEvent.TYPE).build());

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getValue()).isNull();
        });
    }

    @Test
    void messagePluginSeesEventAnnotatedByMiddleware() throws Exception {
        // given
        eventBus.addMiddleware(e -> e.withMetadata("locale", "en"));
        eventBus.addMiddleware(e -> e.withPriority(EventPriority.HIGH));
        pluginManager.loadPlugin(new LocalePlugin());

        // when
        List<HandlerResult> results = eventBus.publishAndWait(new MessageReceivedEvent(message, 7L, 42L));

        // then
        assertThat(results).extracting(HandlerResult::getValue).containsExactly("locale: en");
        verify(message).reply("locale: en");
    }

    @Test
    void messagePluginFailureReachesPluginErrorCallback() throws Exception {
        // given
        LocalePlugin plugin = new LocalePlugin();
        plugin.failure = new IllegalStateException("model offline");
        pluginManager.loadPlugin(plugin);

        // when
        List<HandlerResult> results = eventBus.publishAndWait(new MessageReceivedEvent(message, 7L, 42L));

        // then
        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).containsSame(plugin.failure);
        });
        assertThat(plugin.errors).singleElement().isSameAs(plugin.failure);
        verify(message, never()).reply(anyString());
    }

    @Test
    void adapterIsRemovedOnUnload() {
        EchoPlugin plugin = new EchoPlugin("echo: ", true);
        pluginManager.loadPlugin(plugin);
        assertThat(eventBus.getHandlers(MessageReceivedEvent.TYPE)).singleElement()
            .isInstanceOf(MessagePluginHandler.class);

        pluginManager.unloadPlugin("echo");

        assertThat(eventBus.getHandlers(MessageReceivedEvent.TYPE)).isEmpty();
    }

    // ==================== Callback ====================

    @Test
    void callbackPluginAnswersWithAlert() throws Exception {
        pluginManager.loadPlugin(new ConfirmPlugin());

        eventBus.publishAndWait(new CallbackQueryEvent(callback, 7L, "confirm:task", null));
        eventBus.publishAndWait(new CallbackQueryEvent(callback, 7L, "other", null));

        verify(callback).answer("Task confirmed", true);
        verify(callback, times(1)).answer(anyString(), anyBoolean());
    }

    // ==================== AI ====================

    @Test
    void aiPluginReturnsProcessedData() {
        pluginManager.loadPlugin(new TokenCounterPlugin());

        List<HandlerResult> results = eventBus.publishAndWait(new AIResponseEvent("Done.", 7L, 42L, "gpt-4"));
        List<HandlerResult> empty = eventBus.publishAndWait(new AIResponseEvent("", 7L, 42L, "gpt-4"));

        assertThat(results).singleElement().extracting(HandlerResult::getValue)
            .isEqualTo(Map.of("length", 5, "model", "gpt-4"));
        assertThat(empty).singleElement().extracting(HandlerResult::getValue).isNull();
    }
}
