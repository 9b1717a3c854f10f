package com.acme.assistant.redis;

import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.Codec;
import org.redisson.client.codec.StringCodec;
import org.redisson.codec.CompositeCodec;

/** Codecs shared by the stream adapters: string field names, raw byte values. */
final class RedisCodecs {

  /** Field values stay byte-identical to what the producer wrote. */
  static final Codec STREAM = new CompositeCodec(StringCodec.INSTANCE, ByteArrayCodec.INSTANCE);

  private RedisCodecs() {}
}
