package com.scholary.dubber.transcription;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubber.provider.ProviderCallException;
import com.scholary.dubber.provider.ProviderHttpClient;
import com.scholary.dubber.provider.ProviderProperties;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link Transcriber} backed by Deepgram's pre-recorded listen endpoint.
 *
 * <p>The raw audio file is posted as the request body. With diarization on, Deepgram's utterance
 * list is used directly; otherwise the whole transcript becomes a single utterance of speaker
 * {@code 0} spanning the reported duration.
 */
@Component
public class DeepgramTranscriber implements Transcriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeepgramTranscriber.class);
  private static final String PROVIDER = "deepgram-stt";

  private final ProviderHttpClient httpClient;
  private final ProviderProperties.Deepgram properties;
  private final ObjectMapper objectMapper;

  public DeepgramTranscriber(
      ProviderHttpClient httpClient, ProviderProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties.deepgram();
    this.objectMapper = objectMapper;
  }

  @Override
  public TranscriptionResult transcribe(Path audioPath, String language, boolean diarize) {
    LOGGER.info(
        "Transcribing: file={}, language={}, diarize={}",
        audioPath.getFileName(),
        language,
        diarize);

    byte[] audio;
    try {
      audio = Files.readAllBytes(audioPath);
    } catch (IOException e) {
      throw new TranscriptionException("Audio could not be read for transcription", e);
    }

    Map<String, String> params = new LinkedHashMap<>();
    params.put("model", properties.sttModel());
    params.put("language", language);
    params.put("punctuate", "true");
    params.put("smart_format", "true");
    params.put("paragraphs", "true");
    params.put("numerals", "true");
    params.put("diarize", String.valueOf(diarize));
    params.put("utterances", String.valueOf(diarize));

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v1/listen?" + query(params)))
            .timeout(httpClient.requestTimeout())
            .header("Authorization", "Token " + properties.apiKey())
            .header("Content-Type", "application/octet-stream")
            .POST(HttpRequest.BodyPublishers.ofByteArray(audio))
            .build();

    JsonNode root;
    try {
      root = objectMapper.readTree(httpClient.send(PROVIDER, request));
    } catch (ProviderCallException e) {
      throw new TranscriptionException("Transcription request failed", e);
    } catch (IOException e) {
      throw new TranscriptionException("Transcription response could not be parsed", e);
    }

    TranscriptionResult result = parse(root, diarize);
    LOGGER.info(
        "Transcription complete: {} utterances, duration={}s, confidence={}",
        result.utterances().size(),
        result.durationSeconds(),
        result.confidence());
    return result;
  }

  TranscriptionResult parse(JsonNode root, boolean diarize) {
    JsonNode alternative =
        root.path("results").path("channels").path(0).path("alternatives").path(0);
    if (alternative.isMissingNode()) {
      throw new TranscriptionException("Transcription response has no alternatives");
    }

    String transcript = alternative.path("transcript").asText("");
    double confidence = alternative.path("confidence").asDouble(0.0);
    double duration = root.path("metadata").path("duration").asDouble(0.0);

    List<Utterance> utterances = new ArrayList<>();
    if (diarize) {
      for (JsonNode node : root.path("results").path("utterances")) {
        String text = node.path("transcript").asText("").trim();
        if (text.isEmpty()) {
          continue;
        }
        utterances.add(
            new Utterance(
                node.path("start").asDouble(),
                node.path("end").asDouble(),
                text,
                node.path("speaker").asText("0"),
                node.path("confidence").asDouble(0.0)));
      }
      utterances.sort(Comparator.comparingDouble(Utterance::start));
    } else if (!transcript.isBlank()) {
      utterances.add(new Utterance(0.0, duration, transcript.trim(), "0", confidence));
    }

    return new TranscriptionResult(transcript, confidence, duration, utterances);
  }

  private static String query(Map<String, String> params) {
    return params.entrySet().stream()
        .map(
            e ->
                URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }
}
