package org.hypertrace.core.dashboard.query.service.grafana;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Streams Prometheus responses, keeping only what variable resolution needs. */
class PrometheusMetricQueryResponseParser {

  private static final Gson GSON =
      new GsonBuilder()
          .registerTypeAdapter(
              PrometheusMetricQueryResponse.class,
              new TypeAdapter<PrometheusMetricQueryResponse>() {
                @Override
                public PrometheusMetricQueryResponse read(JsonReader reader) throws IOException {
                  return parseResponse(reader);
                }

                @Override
                public void write(JsonWriter writer, PrometheusMetricQueryResponse response)
                    throws IOException {
                  throw new UnsupportedOperationException("Responses are read only");
                }
              })
          .create();

  private PrometheusMetricQueryResponseParser() {}

  static PrometheusMetricQueryResponse parse(String jsonString) {
    return GSON.fromJson(jsonString, PrometheusMetricQueryResponse.class);
  }

  private static PrometheusMetricQueryResponse parseResponse(JsonReader reader)
      throws IOException {
    PrometheusMetricQueryResponse.PrometheusMetricQueryResponseBuilder responseBuilder =
        PrometheusMetricQueryResponse.builder();

    reader.beginObject();
    while (reader.hasNext()) {
      String propertyName = reader.nextName();
      if ("status".equals(propertyName)) {
        responseBuilder.status(reader.nextString());
      } else if ("error".equals(propertyName)) {
        responseBuilder.error(reader.nextString());
      } else if ("data".equals(propertyName)) {
        parseDataBlock(reader, responseBuilder);
      } else {
        reader.skipValue();
      }
    }
    reader.endObject();

    return responseBuilder.build();
  }

  private static void parseDataBlock(
      JsonReader reader,
      PrometheusMetricQueryResponse.PrometheusMetricQueryResponseBuilder responseBuilder)
      throws IOException {
    // label values answer with a plain array of strings
    if (reader.peek() == JsonToken.BEGIN_ARRAY) {
      reader.beginArray();
      while (reader.hasNext()) {
        responseBuilder.labelValue(reader.nextString());
      }
      reader.endArray();
      return;
    }

    String resultType = null;
    reader.beginObject();
    while (reader.hasNext()) {
      String propertyName = reader.nextName();
      if ("resultType".equals(propertyName)) {
        resultType = reader.nextString();
        responseBuilder.resultType(resultType);
      } else if ("result".equals(propertyName) && isSeriesResult(resultType)) {
        parseResultBlock(reader, responseBuilder);
      } else {
        reader.skipValue();
      }
    }
    reader.endObject();
  }

  private static boolean isSeriesResult(String resultType) {
    return "vector".equalsIgnoreCase(resultType) || "matrix".equalsIgnoreCase(resultType);
  }

  private static void parseResultBlock(
      JsonReader reader,
      PrometheusMetricQueryResponse.PrometheusMetricQueryResponseBuilder responseBuilder)
      throws IOException {
    reader.beginArray();
    while (reader.hasNext()) {
      responseBuilder.metric(parseMetricBlock(reader));
    }
    reader.endArray();
  }

  private static Map<String, String> parseMetricBlock(JsonReader reader) throws IOException {
    Map<String, String> attributes = new LinkedHashMap<>();
    reader.beginObject();
    while (reader.hasNext()) {
      if ("metric".equalsIgnoreCase(reader.nextName())) {
        reader.beginObject();
        while (reader.hasNext()) {
          attributes.put(reader.nextName(), reader.nextString());
        }
        reader.endObject();
      } else {
        // sample values play no part in variable values
        reader.skipValue();
      }
    }
    reader.endObject();
    return attributes;
  }
}
