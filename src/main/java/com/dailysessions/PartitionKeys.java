package com.dailysessions;

import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.values.KV;

/**
 * Keys of the per-timeline grouping. A KV of two strings keeps the key coder deterministic,
 * which grouping requires.
 */
public final class PartitionKeys {

    private PartitionKeys() {
    }

    public static KV<String, String> of(Event event) {
        return KV.of(event.getUserId(), event.getProductCode());
    }

    public static Coder<KV<String, String>> coder() {
        return KvCoder.of(StringUtf8Coder.of(), StringUtf8Coder.of());
    }

    public static <V> KvCoder<KV<String, String>, V> keyedCoder(Coder<V> valueCoder) {
        return KvCoder.of(coder(), valueCoder);
    }

    public static String describe(KV<String, String> key) {
        return "(" + key.getKey() + ", " + key.getValue() + ")";
    }
}
