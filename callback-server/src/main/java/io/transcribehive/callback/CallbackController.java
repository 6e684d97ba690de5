package io.transcribehive.callback;

import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.multipart.MultipartHttpServletRequest;
import org.springframework.web.util.WebUtils;

@RestController
public class CallbackController {

  static final String IDEMPOTENCY_KEY = "Idempotency-Key";
  static final String POST_NOTIFY_ACTION = "postnotifyaction";

  private static final Logger log = LoggerFactory.getLogger(CallbackController.class);

  private final CapturedRequestStore store;
  private final TranscriptLedger ledger;
  private final PostNotifyAction postNotifyAction;
  private final Clock clock;

  @Autowired
  public CallbackController(CapturedRequestStore store, TranscriptLedger ledger, PostNotifyAction postNotifyAction) {
    this(store, ledger, postNotifyAction, Clock.systemUTC());
  }

  CallbackController(CapturedRequestStore store, TranscriptLedger ledger, PostNotifyAction postNotifyAction,
                     Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.postNotifyAction = Objects.requireNonNull(postNotifyAction, "postNotifyAction");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
  public List<CapturedRequest> list() {
    return store.list();
  }

  @GetMapping(value = "/transcripts", produces = MediaType.APPLICATION_JSON_VALUE)
  public List<TranscriptLedger.Entry> transcripts() {
    return ledger.entries();
  }

  @RequestMapping(value = "/", method = {RequestMethod.POST, RequestMethod.PUT})
  public ResponseEntity<String> capture(HttpServletRequest request) throws IOException {
    Instant now = clock.instant();
    Map<String, String> args = queryArgs(request);
    MultipartHttpServletRequest multipart = WebUtils.getNativeRequest(request, MultipartHttpServletRequest.class);
    String text = multipart != null ? "" : decodeOrElse(
        StreamUtils.copyToByteArray(request.getInputStream()), "decode error");

    Map<String, Object> actionOutcome = null;
    if (args.containsKey(POST_NOTIFY_ACTION)) {
      actionOutcome = postNotifyAction.run(request.getHeader(PostNotifyAction.ACTION_URL),
          request.getHeader(PostNotifyAction.ACTION_AUTH), args.get("id"));
    }

    CapturedRequest captured = new CapturedRequest(files(multipart), text, args, headers(request),
        request.getMethod(), now.getEpochSecond(), request.getRemoteAddr(), actionOutcome);
    store.add(captured);

    String key = request.getHeader(IDEMPOTENCY_KEY);
    if (key == null || key.isBlank()) {
      key = args.get("id");
    }
    if (key != null && !key.isBlank()) {
      TranscriptLedger.Entry entry = ledger.record(key, args.get("status"), text, now);
      log.info("Captured {} for {} (status={}, deliveries={})", request.getMethod(), key, entry.status(),
          entry.deliveries());
    } else {
      log.info("Captured {} without job id from {}", request.getMethod(), request.getRemoteAddr());
    }
    return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body("ok");
  }

  // first value wins; query parameters only, form fields are part of the body
  private static Map<String, String> queryArgs(HttpServletRequest request) {
    Map<String, String> args = new LinkedHashMap<>();
    String query = request.getQueryString();
    if (query == null || query.isEmpty()) {
      return args;
    }
    for (String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String name = decodeComponent(eq < 0 ? pair : pair.substring(0, eq));
      String value = eq < 0 ? "" : decodeComponent(pair.substring(eq + 1));
      args.putIfAbsent(name, value);
    }
    return args;
  }

  private static String decodeComponent(String raw) {
    try {
      return URLDecoder.decode(raw, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      return raw;
    }
  }

  private static Map<String, String> headers(HttpServletRequest request) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (String name : Collections.list(request.getHeaderNames())) {
      headers.put(name, request.getHeader(name));
    }
    return headers;
  }

  private static Map<String, String> files(MultipartHttpServletRequest multipart) throws IOException {
    Map<String, String> files = new LinkedHashMap<>();
    if (multipart != null) {
      for (Map.Entry<String, MultipartFile> part : multipart.getFileMap().entrySet()) {
        byte[] data = part.getValue().getBytes();
        files.put(part.getKey(), decodeOrElse(data, "<binary data:" + data.length + " bytes>"));
      }
    }
    return files;
  }

  private static String decodeOrElse(byte[] data, String fallback) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(data))
          .toString();
    } catch (CharacterCodingException ex) {
      return fallback;
    }
  }
}
