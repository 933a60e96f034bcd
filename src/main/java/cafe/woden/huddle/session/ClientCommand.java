package cafe.woden.huddle.session;

import java.util.List;
import java.util.Objects;

/** Decoded client operation. Field validation beyond shape happens in the session. */
public sealed interface ClientCommand
    permits ClientCommand.Join,
        ClientCommand.Leave,
        ClientCommand.SendMessage,
        ClientCommand.EditMessage,
        ClientCommand.DeleteMessage,
        ClientCommand.AddReaction,
        ClientCommand.RemoveReaction,
        ClientCommand.TypingStart,
        ClientCommand.TypingStop,
        ClientCommand.MarkRead,
        ClientCommand.LoadOlderMessages,
        ClientCommand.StartThread,
        ClientCommand.UpdateStatus {

  /** Wire op name. */
  String op();

  record Join() implements ClientCommand {
    @Override
    public String op() {
      return "join";
    }
  }

  record Leave() implements ClientCommand {
    @Override
    public String op() {
      return "leave";
    }
  }

  record SendMessage(String content, List<String> attachments, String threadId)
      implements ClientCommand {
    public SendMessage {
      attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    @Override
    public String op() {
      return "send_message";
    }
  }

  record EditMessage(String messageId, String content) implements ClientCommand {
    @Override
    public String op() {
      return "edit_message";
    }
  }

  record DeleteMessage(String messageId) implements ClientCommand {
    @Override
    public String op() {
      return "delete_message";
    }
  }

  record AddReaction(String messageId, String emoji) implements ClientCommand {
    @Override
    public String op() {
      return "add_reaction";
    }
  }

  record RemoveReaction(String messageId, String emoji) implements ClientCommand {
    @Override
    public String op() {
      return "remove_reaction";
    }
  }

  record TypingStart() implements ClientCommand {
    @Override
    public String op() {
      return "typing_start";
    }
  }

  record TypingStop() implements ClientCommand {
    @Override
    public String op() {
      return "typing_stop";
    }
  }

  record MarkRead(String messageId) implements ClientCommand {
    @Override
    public String op() {
      return "mark_read";
    }
  }

  record LoadOlderMessages(String beforeId) implements ClientCommand {
    @Override
    public String op() {
      return "load_older_messages";
    }
  }

  /** Creates the first reply of a thread under {@code messageId}. */
  record StartThread(String messageId, String content) implements ClientCommand {
    @Override
    public String op() {
      return "start_thread";
    }
  }

  record UpdateStatus(String status) implements ClientCommand {
    public UpdateStatus {
      status = Objects.toString(status, "").trim();
    }

    @Override
    public String op() {
      return "update_status";
    }
  }
}
