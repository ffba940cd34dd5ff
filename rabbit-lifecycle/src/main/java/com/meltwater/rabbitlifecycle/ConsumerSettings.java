package com.meltwater.rabbitlifecycle;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * This class contains the settings used when starting a consumer with
 * {@link RabbitChannel#consume(String, MessageHandler, ConsumerSettings)} and by the {@link RetryingMessageHandler}.
 *
 * The prefetch count is a channel setting, it is applied with {@link RabbitChannel#prefetch(int)}.
 */
public class ConsumerSettings {

    public static final int DEFAULT_PREFETCH_COUNT = 256;
    public static final int DEFAULT_MAX_REDELIVERED_COUNT = 3;

    private int pre_fetch_count         = DEFAULT_PREFETCH_COUNT;
    private int max_redelivered_count   = DEFAULT_MAX_REDELIVERED_COUNT;
    private String consumer_tag_prefix  = ""; //empty means broker generated tags
    private boolean exclusive           = false;

    public int getPre_fetch_count() {
        return pre_fetch_count;
    }

    public int getMax_redelivered_count() {
        return max_redelivered_count;
    }

    public String getConsumer_tag_prefix() {
        return consumer_tag_prefix;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public ConsumerSettings withPreFetchCount(int pre_fetch_count) {
        checkArgument(pre_fetch_count >= 0, "pre_fetch_count must be >= 0 but was %s", pre_fetch_count);
        this.pre_fetch_count = pre_fetch_count;
        return this;
    }

    public ConsumerSettings withMaxRedeliveredCount(int max_redelivered_count) {
        checkArgument(max_redelivered_count >= 0, "max_redelivered_count must be >= 0 but was %s", max_redelivered_count);
        this.max_redelivered_count = max_redelivered_count;
        return this;
    }

    public ConsumerSettings withConsumerTagPrefix(String consumer_tag_prefix) {
        this.consumer_tag_prefix = checkNotNull(consumer_tag_prefix, "consumer_tag_prefix");
        return this;
    }

    public ConsumerSettings withExclusive(boolean exclusive) {
        this.exclusive = exclusive;
        return this;
    }

    @Override
    public String toString() {
        return "{" +
                "pre_fetch_count:" + pre_fetch_count +
                ", max_redelivered_count:" + max_redelivered_count +
                ", consumer_tag_prefix:'" + consumer_tag_prefix + "'" +
                ", exclusive:" + exclusive +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsumerSettings that = (ConsumerSettings) o;
        if (pre_fetch_count != that.pre_fetch_count) return false;
        if (max_redelivered_count != that.max_redelivered_count) return false;
        if (exclusive != that.exclusive) return false;
        return consumer_tag_prefix.equals(that.consumer_tag_prefix);
    }

    @Override
    public int hashCode() {
        int result = pre_fetch_count;
        result = 31 * result + max_redelivered_count;
        result = 31 * result + consumer_tag_prefix.hashCode();
        result = 31 * result + (exclusive ? 1 : 0);
        return result;
    }
}
