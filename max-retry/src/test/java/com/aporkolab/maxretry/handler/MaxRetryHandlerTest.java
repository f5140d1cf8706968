package com.aporkolab.maxretry.handler;

import static com.aporkolab.maxretry.handler.DeathHistory.history;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.aporkolab.maxretry.exception.BrokerOperationException;
import com.aporkolab.maxretry.exception.TopologyDeclarationException;
import com.aporkolab.maxretry.metrics.RetryMetrics;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;

@ExtendWith(MockitoExtension.class)
class MaxRetryHandlerTest {

    private static final String WORKER_QUEUE = "orders";
    private static final String ROUTING_KEY = "order.created";
    private static final byte[] BODY = "{\"orderId\":123}".getBytes(StandardCharsets.UTF_8);

    @Mock
    private Channel channel;

    @Mock
    private RetryMetrics metrics;

    private MaxRetryHandler handler;

    @BeforeEach
    void setUp() {
        handler = new MaxRetryHandler(channel, WORKER_QUEUE, MaxRetryOptions.defaults(), metrics);
        clearInvocations(channel);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should declare topology before accepting deliveries")
        void shouldDeclareTopology() throws Exception {
            Channel fresh = mock(Channel.class);

            MaxRetryHandler created = new MaxRetryHandler(fresh, WORKER_QUEUE, MaxRetryOptions.defaults());

            verify(fresh).queueBind(WORKER_QUEUE, "orders-retry-requeue", "#");
            assertThat(created.getTopologyNames().errorExchange()).isEqualTo("orders-error");
        }

        @Test
        @DisplayName("should fail construction when topology cannot be declared")
        void shouldFailOnTopologyError() throws Exception {
            Channel broken = mock(Channel.class);
            when(broken.exchangeDeclare(anyString(), any(BuiltinExchangeType.class), anyBoolean()))
                    .thenThrow(new IOException("connection closed"));

            assertThatThrownBy(() -> new MaxRetryHandler(broken, WORKER_QUEUE, MaxRetryOptions.defaults()))
                    .isInstanceOf(TopologyDeclarationException.class);
        }

        @Test
        @DisplayName("two handlers with identical options should both construct")
        void shouldConstructTwice() {
            MaxRetryHandler second = new MaxRetryHandler(channel, WORKER_QUEUE, MaxRetryOptions.defaults(), metrics);

            assertThat(second.getTopologyNames()).isEqualTo(handler.getTopologyNames());
        }
    }

    @Nested
    @DisplayName("Acknowledge")
    class Acknowledge {

        @Test
        @DisplayName("should ack without looking at history")
        void shouldAckUnconditionally() throws Exception {
            AMQP.BasicProperties exhausted = history().died(WORKER_QUEUE, 50).properties();

            Disposition disposition = handler.acknowledge(envelope(7L), exhausted, BODY);

            assertThat(disposition).isEqualTo(Disposition.ACKNOWLEDGE);
            verify(channel).basicAck(7L, false);
            verify(channel, never()).basicPublish(anyString(), anyString(), any(), any());
            verify(channel, never()).basicReject(anyLong(), anyBoolean());
            verify(metrics).increment("orders.ack");
        }
    }

    @Nested
    @DisplayName("Reject")
    class Reject {

        @ParameterizedTest(name = "{0} prior failures")
        @ValueSource(ints = {0, 1, 2, 3, 4})
        @DisplayName("should retry while under the limit")
        void shouldRetryUnderLimit(int priorFailures) throws Exception {
            AMQP.BasicProperties properties = history().died(WORKER_QUEUE, priorFailures).properties();

            Disposition disposition = handler.reject(envelope(1L), properties, BODY, false);

            assertThat(disposition).isEqualTo(Disposition.RETRY_REJECT);
            verify(channel).basicReject(1L, false);
            verify(channel, never()).basicPublish(anyString(), anyString(), any(), any());
            verify(channel, never()).basicAck(anyLong(), anyBoolean());
            verify(metrics).increment("orders.retry");
        }

        @ParameterizedTest(name = "{0} prior failures")
        @ValueSource(ints = {5, 6, 10, 25})
        @DisplayName("should dead-letter once the limit is reached")
        void shouldDeadLetterAtLimit(int priorFailures) throws Exception {
            AMQP.BasicProperties properties = history().died(WORKER_QUEUE, priorFailures).properties();

            Disposition disposition = handler.reject(envelope(2L), properties, BODY, false);

            assertThat(disposition).isEqualTo(Disposition.DEAD_LETTER);
            InOrder inOrder = inOrder(channel);
            inOrder.verify(channel).basicPublish("orders-error", ROUTING_KEY, properties, BODY);
            inOrder.verify(channel).basicAck(2L, false);
            verify(channel, times(1)).basicPublish(anyString(), anyString(), any(), any());
            verify(channel, never()).basicReject(anyLong(), anyBoolean());
            verify(metrics).increment("orders.dead_letter");
        }

        @ParameterizedTest(name = "{0} prior failures")
        @ValueSource(ints = {0, 4, 5, 10, 100})
        @DisplayName("forced requeue should always reject with requeue")
        void shouldAlwaysRequeueWhenForced(int priorFailures) throws Exception {
            AMQP.BasicProperties properties = history().died(WORKER_QUEUE, priorFailures).properties();

            Disposition disposition = handler.reject(envelope(3L), properties, BODY, true);

            assertThat(disposition).isEqualTo(Disposition.RETRY_REJECT);
            verify(channel).basicReject(3L, true);
            verify(channel, never()).basicPublish(anyString(), anyString(), any(), any());
            verify(metrics).increment("orders.requeue");
        }

        @Test
        @DisplayName("should ignore failures recorded on other queues")
        void shouldIgnoreOtherQueues() throws Exception {
            AMQP.BasicProperties properties = history()
                    .died("payments", 10)
                    .died("orders-retry", 10)
                    .died(WORKER_QUEUE, 4)
                    .properties();

            assertThat(handler.reject(envelope(4L), properties, BODY)).isEqualTo(Disposition.RETRY_REJECT);
            verify(channel).basicReject(4L, false);
        }

        @Test
        @DisplayName("should treat missing properties as a first failure")
        void shouldHandleMissingProperties() throws Exception {
            assertThat(handler.reject(envelope(5L), null, BODY)).isEqualTo(Disposition.RETRY_REJECT);
            verify(channel).basicReject(5L, false);
        }

        @Test
        @DisplayName("should dead-letter on the first failure when max retries is 0")
        void shouldDeadLetterImmediatelyWithZeroRetries() throws Exception {
            MaxRetryHandler noRetries = new MaxRetryHandler(
                    channel, WORKER_QUEUE, MaxRetryOptions.builder().maxRetries(0).build(), metrics);

            assertThat(noRetries.reject(envelope(6L), null, BODY)).isEqualTo(Disposition.DEAD_LETTER);
            verify(channel).basicPublish("orders-error", ROUTING_KEY, null, BODY);
            verify(channel).basicAck(6L, false);
        }

        @Test
        @DisplayName("should use the broker count field when configured")
        void shouldUseCountField() throws Exception {
            MaxRetryHandler countField = new MaxRetryHandler(channel, WORKER_QUEUE, MaxRetryOptions.builder()
                    .deathCountStrategy(DeathCountStrategy.COUNT_FIELD)
                    .build(), metrics);
            AMQP.BasicProperties properties = history()
                    .entry(WORKER_QUEUE, "rejected", 5L)
                    .entry("orders-retry", "expired", 5L)
                    .properties();

            assertThat(countField.failureCount(properties)).isEqualTo(5);
            assertThat(countField.reject(envelope(8L), properties, BODY)).isEqualTo(Disposition.DEAD_LETTER);
        }
    }

    @Nested
    @DisplayName("Error and timeout")
    class ErrorAndTimeout {

        @Test
        @DisplayName("scenario A: error with 4 prior failures should retry")
        void errorUnderLimitRetries() throws Exception {
            AMQP.BasicProperties properties = history().died(WORKER_QUEUE, 4).properties();

            Disposition disposition = handler.error(envelope(10L), properties, BODY, new IllegalStateException("boom"));

            assertThat(disposition).isEqualTo(Disposition.RETRY_REJECT);
            verify(channel).basicReject(10L, false);
        }

        @Test
        @DisplayName("scenario B: error with 5 prior failures should dead-letter")
        void errorAtLimitDeadLetters() throws Exception {
            AMQP.BasicProperties properties = history().died(WORKER_QUEUE, 5).properties();

            Disposition disposition = handler.error(envelope(11L), properties, BODY, new RuntimeException("boom"));

            assertThat(disposition).isEqualTo(Disposition.DEAD_LETTER);
            verify(channel).basicPublish("orders-error", ROUTING_KEY, properties, BODY);
            verify(channel).basicAck(11L, false);
        }

        @Test
        @DisplayName("scenario C: forced requeue with 10 prior failures should still requeue")
        void forcedRequeueOverridesExhaustion() throws Exception {
            AMQP.BasicProperties properties = history().died(WORKER_QUEUE, 10).properties();

            assertThat(handler.reject(envelope(12L), properties, BODY, true)).isEqualTo(Disposition.RETRY_REJECT);
            verify(channel).basicReject(12L, true);
            verify(channel, never()).basicAck(anyLong(), anyBoolean());
        }

        @Test
        @DisplayName("should route every error type the same way")
        void shouldTreatAllErrorsAlike() throws Exception {
            AMQP.BasicProperties properties = history().died(WORKER_QUEUE, 1).properties();

            handler.error(envelope(13L), properties, BODY, new OutOfMemoryError("simulated"));
            handler.error(envelope(14L), properties, BODY, null);

            verify(channel).basicReject(13L, false);
            verify(channel).basicReject(14L, false);
        }

        @Test
        @DisplayName("timeout should behave like an error")
        void timeoutBehavesLikeError() throws Exception {
            assertThat(handler.timeout(envelope(15L), history().died(WORKER_QUEUE, 2).properties(), BODY))
                    .isEqualTo(Disposition.RETRY_REJECT);
            assertThat(handler.timeout(envelope(16L), history().died(WORKER_QUEUE, 5).properties(), BODY))
                    .isEqualTo(Disposition.DEAD_LETTER);

            verify(channel).basicReject(15L, false);
            verify(channel).basicAck(16L, false);
        }
    }

    @Nested
    @DisplayName("Noop")
    class Noop {

        @Test
        @DisplayName("should not touch the channel")
        void shouldNotTouchChannel() {
            handler.noop(envelope(20L), history().died(WORKER_QUEUE, 9).properties(), BODY);

            verifyNoInteractions(channel);
            verify(metrics).increment("orders.noop");
        }
    }

    @Nested
    @DisplayName("Broker failures")
    class BrokerFailures {

        @Test
        @DisplayName("should surface reject failure")
        void shouldSurfaceRejectFailure() throws Exception {
            doThrow(new IOException("channel closed")).when(channel).basicReject(30L, false);

            assertThatThrownBy(() -> handler.reject(envelope(30L), null, BODY))
                    .isInstanceOf(BrokerOperationException.class)
                    .hasMessageContaining("basic.reject");
            verify(metrics, never()).increment(anyString());
        }

        @Test
        @DisplayName("should not ack when publishing to the error exchange fails")
        void shouldNotAckWhenPublishFails() throws Exception {
            AMQP.BasicProperties properties = history().died(WORKER_QUEUE, 5).properties();
            doThrow(new IOException("connection reset"))
                    .when(channel).basicPublish("orders-error", ROUTING_KEY, properties, BODY);

            assertThatThrownBy(() -> handler.reject(envelope(31L), properties, BODY))
                    .isInstanceOf(BrokerOperationException.class)
                    .hasMessageContaining("basic.publish");
            verify(channel, never()).basicAck(anyLong(), anyBoolean());
        }

        @Test
        @DisplayName("should surface ack failure")
        void shouldSurfaceAckFailure() throws Exception {
            doThrow(new IOException("unknown delivery tag")).when(channel).basicAck(32L, false);

            assertThatThrownBy(() -> handler.acknowledge(envelope(32L), null, BODY))
                    .isInstanceOf(BrokerOperationException.class)
                    .hasMessageContaining("basic.ack");
        }
    }

    private static Envelope envelope(long deliveryTag) {
        return new Envelope(deliveryTag, false, "orders-exchange", ROUTING_KEY);
    }
}
