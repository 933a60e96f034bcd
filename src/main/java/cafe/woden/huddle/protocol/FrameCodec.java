package cafe.woden.huddle.protocol;

import cafe.woden.huddle.model.ChatMessage;
import cafe.woden.huddle.model.PresenceDiff;
import cafe.woden.huddle.model.PresenceMeta;
import cafe.woden.huddle.model.SequencedEvent;
import cafe.woden.huddle.model.TopicEvent;
import cafe.woden.huddle.session.ClientCommand;
import cafe.woden.huddle.session.ClientFrame;
import cafe.woden.huddle.session.ServerPush;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jmolecules.architecture.layered.InterfaceLayer;
import org.springframework.stereotype.Component;

/**
 * JSON text-frame codec.
 *
 * <p>Client frames are objects with an {@code op}, an optional {@code topic} and {@code
 * client_ref}, and the op's fields either at top level or under {@code payload}. Server frames are
 * objects with an {@code event} name and the {@code topic} they belong to.
 */
@Component
@InterfaceLayer
public class FrameCodec {

  private static final ObjectMapper JSON = new ObjectMapper();

  public ClientFrame decode(String text) {
    JsonNode root;
    try {
      root = JSON.readTree(text == null ? "" : text);
    } catch (JsonProcessingException e) {
      throw new MalformedFrameException("frame is not valid JSON", "", "", null);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedFrameException("frame must be a JSON object", "", "", null);
    }

    String op = text(root, "op");
    String topic = text(root, "topic");
    String clientRef = text(root, "client_ref");
    JsonNode payload = root.path("payload").isObject() ? root.get("payload") : root;

    FieldReader f = new FieldReader(payload, op, topic, clientRef);
    ClientCommand command =
        switch (op == null ? "" : op) {
          case "join" -> new ClientCommand.Join();
          case "leave" -> new ClientCommand.Leave();
          case "send_message" ->
              new ClientCommand.SendMessage(
                  f.optional("content"), f.strings("attachments"), f.optional("thread_id"));
          case "edit_message" ->
              new ClientCommand.EditMessage(f.required("message_id"), f.optional("content"));
          case "delete_message" -> new ClientCommand.DeleteMessage(f.required("message_id"));
          case "add_reaction" ->
              new ClientCommand.AddReaction(f.required("message_id"), f.required("emoji"));
          case "remove_reaction" ->
              new ClientCommand.RemoveReaction(f.required("message_id"), f.required("emoji"));
          case "typing_start" -> new ClientCommand.TypingStart();
          case "typing_stop" -> new ClientCommand.TypingStop();
          case "mark_read" -> new ClientCommand.MarkRead(f.required("message_id"));
          case "load_older_messages" ->
              new ClientCommand.LoadOlderMessages(f.required("before_id"));
          case "start_thread" ->
              new ClientCommand.StartThread(f.required("message_id"), f.optional("content"));
          case "update_status" -> new ClientCommand.UpdateStatus(f.required("status"));
          default ->
              throw new MalformedFrameException(
                  op == null ? "op is missing" : "unknown op " + op, op, topic, clientRef);
        };
    return new ClientFrame(topic, clientRef, command);
  }

  public String encode(ServerPush push) {
    ObjectNode out = JSON.createObjectNode();
    if (push instanceof ServerPush.Joined joined) {
      out.put("event", "joined");
      out.put("topic", joined.topic());
      ObjectNode snapshot = out.putObject("snapshot");
      snapshot.set("presence", presence(joined.presence()));
      snapshot.set("recent_messages", messages(joined.recentMessages()));
    } else if (push instanceof ServerPush.Error error) {
      out.put("event", "error");
      out.put("topic", error.topic());
      out.put("op", error.op());
      out.put("reason", error.reason());
      if (error.clientRef() != null) out.put("client_ref", error.clientRef());
    } else if (push instanceof ServerPush.OlderMessagesLoaded older) {
      out.put("event", "older_messages_loaded");
      out.put("topic", older.topic());
      out.set("messages", messages(older.messages()));
      if (older.clientRef() != null) out.put("client_ref", older.clientRef());
    } else if (push instanceof ServerPush.Event event) {
      writeEvent(out, event.event());
    } else {
      throw new IllegalArgumentException("unsupported push " + push);
    }
    try {
      return JSON.writeValueAsString(out);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("could not encode " + push.getClass().getSimpleName(), e);
    }
  }

  private static void writeEvent(ObjectNode out, SequencedEvent sequenced) {
    TopicEvent e = sequenced.event();
    out.put("event", e.eventName());
    out.put("topic", sequenced.topic().value());
    out.put("seq", sequenced.seq());

    if (e instanceof TopicEvent.MessageCreated created) {
      out.set("message", message(created.message()));
    } else if (e instanceof TopicEvent.MessageEdited edited) {
      out.set("message", message(edited.message()));
    } else if (e instanceof TopicEvent.MessageDeleted deleted) {
      out.set("message", message(deleted.message()));
    } else if (e instanceof TopicEvent.ReactionAdded added) {
      out.put("message_id", added.messageId());
      out.put("emoji", added.emoji());
      out.put("identity", added.identity());
    } else if (e instanceof TopicEvent.ReactionRemoved removed) {
      out.put("message_id", removed.messageId());
      out.put("emoji", removed.emoji());
      out.put("identity", removed.identity());
    } else if (e instanceof TopicEvent.ThreadReplyCreated reply) {
      out.put("parent_id", reply.parentId());
      out.set("message", message(reply.reply()));
    } else if (e instanceof TopicEvent.MessageRead read) {
      out.put("message_id", read.messageId());
      out.put("identity", read.identity());
    } else if (e instanceof TopicEvent.TypingStarted started) {
      out.put("identity", started.identity());
    } else if (e instanceof TopicEvent.TypingStopped stopped) {
      out.put("identity", stopped.identity());
    } else if (e instanceof TopicEvent.PresenceDiffed diffed) {
      PresenceDiff diff = diffed.diff();
      out.set("joins", presence(diff.joins()));
      out.set("leaves", presence(diff.leaves()));
    }
  }

  private static ObjectNode presence(Map<String, List<PresenceMeta>> byIdentity) {
    ObjectNode node = JSON.createObjectNode();
    byIdentity.forEach(
        (identity, metas) -> {
          ArrayNode arr = node.putObject(identity).putArray("metas");
          for (PresenceMeta m : metas) {
            ObjectNode meta = arr.addObject();
            meta.put("device_id", m.deviceId());
            meta.put("status", m.status().wireName());
            meta.put("joined_at", instant(m.joinedAt()));
          }
        });
    return node;
  }

  private static ArrayNode messages(List<ChatMessage> messages) {
    ArrayNode arr = JSON.createArrayNode();
    for (ChatMessage m : messages) arr.add(message(m));
    return arr;
  }

  private static ObjectNode message(ChatMessage m) {
    ObjectNode node = JSON.createObjectNode();
    node.put("id", m.id());
    node.put("topic", m.topic().value());
    node.put("author_id", m.authorId());
    node.put("content", m.content());
    ArrayNode attachments = node.putArray("attachments");
    m.attachments().forEach(attachments::add);
    if (m.parentId() != null) node.put("parent_id", m.parentId());
    node.put("created_at", instant(m.createdAt()));
    if (m.editedAt() != null) {
      node.put("edited_at", instant(m.editedAt()));
    } else {
      node.putNull("edited_at");
    }
    return node;
  }

  private static String instant(Instant at) {
    return at == null ? null : at.toString();
  }

  private static String text(JsonNode node, String key) {
    JsonNode v = node.get(key);
    if (v == null || v.isMissingNode() || v.isNull()) return null;
    if (v.isTextual() || v.isNumber()) {
      String t = v.asText().strip();
      return t.isEmpty() ? null : t;
    }
    return null;
  }

  /** Reads op fields, failing with the frame's correlation data attached. */
  private static final class FieldReader {
    private final JsonNode node;
    private final String op;
    private final String topic;
    private final String clientRef;

    FieldReader(JsonNode node, String op, String topic, String clientRef) {
      this.node = node;
      this.op = op;
      this.topic = topic;
      this.clientRef = clientRef;
    }

    String required(String key) {
      String v = optional(key);
      if (v == null || v.isBlank()) throw invalid(key + " is required");
      return v;
    }

    String optional(String key) {
      JsonNode v = node.get(key);
      if (v == null || v.isNull()) return null;
      if (!v.isTextual()) throw invalid(key + " must be a string");
      return v.asText();
    }

    List<String> strings(String key) {
      JsonNode v = node.get(key);
      if (v == null || v.isNull()) return List.of();
      if (!v.isArray()) throw invalid(key + " must be an array");
      List<String> out = new ArrayList<>(v.size());
      for (JsonNode item : v) {
        if (!item.isTextual()) throw invalid(key + " must contain strings");
        out.add(item.asText());
      }
      return out;
    }

    private MalformedFrameException invalid(String message) {
      return new MalformedFrameException(message, op, topic, clientRef);
    }
  }
}
