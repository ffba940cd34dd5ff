package com.meltwater.rabbitlifecycle.exception;

import com.meltwater.rabbitlifecycle.Message;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.Test;
import rx.exceptions.CompositeException;

import java.io.IOException;
import java.util.Arrays;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThat;

public class RabbitLifecycleExceptionTest {

    private static ShutdownSignalException forcedClose() {
        AMQP.Connection.Close close = new AMQP.Connection.Close.Builder()
                .replyCode(320)
                .replyText("CONNECTION_FORCED - broker forced connection closure")
                .build();
        return new ShutdownSignalException(true, false, close, null);
    }

    @Test
    public void captures_the_broker_close_reason() {
        ConnectionException error = new ConnectionException("Connection failed", forcedClose());
        assertThat(error.getLevel(), is(RabbitLifecycleException.Level.CONNECTION));
        assertThat(error.getTransportDiagnostic(), containsString("CONNECTION_FORCED"));
    }

    @Test
    public void wrapping_keeps_the_diagnostic_of_the_inner_failure() {
        ChannelException inner = new ChannelException("Channel failed", forcedClose());
        ConsumerException outer = new ConsumerException("Consumer failed", inner);
        assertThat(outer.getLevel(), is(RabbitLifecycleException.Level.CONSUMER));
        assertThat(outer.getTransportDiagnostic(), is(inner.getTransportDiagnostic()));
    }

    @Test
    public void report_shows_the_whole_chain() {
        CompositeException aggregated = new CompositeException(Arrays.asList(
                new IOException("first"),
                new IllegalStateException("second")));
        ChannelException error = new ChannelException("Channel 3 failed", new ConnectionException("Connection failed", aggregated));

        String report = error.report();

        assertThat(report, containsString("[channel] ChannelException: Channel 3 failed"));
        assertThat(report, containsString("caused by: [connection] ConnectionException: Connection failed"));
        assertThat(report, containsString("inner failure 1: IOException: first"));
        assertThat(report, containsString("inner failure 2: IllegalStateException: second"));
    }

    @Test
    public void report_includes_the_transport_diagnostic_when_there_is_one() {
        ChannelClosedException closed = new ChannelClosedException(true);
        assertThat(closed.getTransportDiagnostic(), is(nullValue()));
        assertThat(closed.report(), is("[channel] ChannelClosedException: " + closed.getMessage() + "\n"));

        String withDiagnostic = new ConnectionException("down", forcedClose()).report();
        assertThat(withDiagnostic, containsString("transport diagnostic: "));
        assertThat(withDiagnostic, containsString("reply-code=320"));
    }

    @Test
    public void invalid_state_names_operation_and_status() {
        InvalidStateException error = new InvalidStateException("ack", Message.Status.DEQUEUED);
        assertThat(error.getMessage(), is("Cannot ack message, it is already dequeued"));
        assertThat(error.getLevel(), is(RabbitLifecycleException.Level.MESSAGE));
        assertThat(error.getStatus(), is(Message.Status.DEQUEUED));
    }
}
