package org.monkey.junit.extensions.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Drives {@link LogWatchExtension} through a mocked extension context, so its verdicts can be
 * asserted without failing this test class itself.
 */
@Tag("unit")
class LogWatchExtensionTest {

    private static final Logger LOG = LoggerFactory.getLogger("org.monkey.watched");

    private final LogWatchExtension extension = new LogWatchExtension();
    private final Map<String, Object> store = new HashMap<>();
    private ExtensionContext classContext;

    @BeforeEach
    void setUp() {
        classContext = contextFor(null);
        extension.beforeAll(classContext);
    }

    @AfterEach
    void tearDown() {
        extension.afterAll(classContext);
    }

    @Test
    void allowLog_toleratesEventsUpToItsOccurrences() throws Exception {
        ExtensionContext context = contextFor(Fixture.class.getDeclaredMethod("allowOnce"));
        extension.beforeEach(context);

        LOG.warn("Disk almost full");

        assertThatCode(() -> extension.afterEach(context)).doesNotThrowAnyException();
    }

    @Test
    void allowLog_rejectsEventsBeyondItsOccurrences() throws Exception {
        ExtensionContext context = contextFor(Fixture.class.getDeclaredMethod("allowOnce"));
        extension.beforeEach(context);

        LOG.warn("Disk almost full");
        LOG.warn("Disk almost full");

        assertThatThrownBy(() -> extension.afterEach(context))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Unexpected log: [WARN] org.monkey.watched - Disk almost full");
    }

    @Test
    void allowLog_withoutOccurrencesToleratesAnyNumber() throws Exception {
        ExtensionContext context = contextFor(Fixture.class.getDeclaredMethod("allowAlways"));
        extension.beforeEach(context);

        for (int i = 0; i < 5; i++) {
            LOG.warn("Disk almost full");
        }

        assertThatCode(() -> extension.afterEach(context)).doesNotThrowAnyException();
    }

    @Test
    void expectLog_failsWhenEventIsMissing() throws Exception {
        ExtensionContext context = contextFor(Fixture.class.getDeclaredMethod("expectError"));
        extension.beforeEach(context);

        assertThatThrownBy(() -> extension.afterEach(context))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Missing expected log");
    }

    @Test
    void unannotatedTest_failsOnWarning() throws Exception {
        ExtensionContext context = contextFor(Fixture.class.getDeclaredMethod("plain"));
        extension.beforeEach(context);

        LOG.warn("Something odd");

        assertThatThrownBy(() -> extension.afterEach(context))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Something odd");
    }

    @SuppressWarnings("unchecked")
    private ExtensionContext contextFor(Method method) {
        ExtensionContext.Store contextStore = mock(ExtensionContext.Store.class);
        doAnswer(invocation -> store.put(invocation.getArgument(0), invocation.getArgument(1)))
                .when(contextStore).put(any(), any());
        when(contextStore.get(anyString(), any(Class.class)))
                .thenAnswer(invocation -> store.get(invocation.<String>getArgument(0)));
        when(contextStore.remove(anyString(), any(Class.class)))
                .thenAnswer(invocation -> store.remove(invocation.<String>getArgument(0)));

        ExtensionContext context = mock(ExtensionContext.class);
        when(context.getStore(any())).thenReturn(contextStore);
        when(context.getTestClass()).thenReturn(Optional.<Class<?>>of(Fixture.class));
        when(context.getTestMethod()).thenReturn(Optional.ofNullable(method));
        AnnotatedElement element = method != null ? method : Fixture.class;
        when(context.getElement()).thenReturn(Optional.of(element));
        return context;
    }

    @SuppressWarnings("unused")
    static class Fixture {

        @AllowLog(level = LogLevel.WARN, loggerPattern = "org\\.monkey\\.watched", messagePattern = "Disk.*", occurrences = 1)
        void allowOnce() {
        }

        @AllowLog(level = LogLevel.WARN, loggerPattern = "org\\.monkey\\.watched")
        void allowAlways() {
        }

        @ExpectLog(level = LogLevel.ERROR, loggerPattern = "org\\.monkey\\.watched")
        void expectError() {
        }

        void plain() {
        }
    }
}
