package com.hydrowatch.detection.config;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.EncoderFactory;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

/** Plain Avro binary encoding of a record against its own schema; no registry framing. */
public class AvroRecordSerializer implements Serializer<GenericRecord> {

  @Override
  public byte[] serialize(String topic, GenericRecord data) {
    if (data == null) return null;
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
      new GenericDatumWriter<GenericRecord>(data.getSchema()).write(data, encoder);
      encoder.flush();
      return out.toByteArray();
    } catch (IOException | RuntimeException e) {
      throw new SerializationException("Avro encoding failed for topic " + topic, e);
    }
  }
}
