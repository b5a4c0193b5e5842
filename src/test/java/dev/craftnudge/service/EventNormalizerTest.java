package dev.craftnudge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.craftnudge.domain.entity.IngestionEvent;
import dev.craftnudge.domain.enums.ChangeKind;
import dev.craftnudge.domain.enums.EventSource;
import dev.craftnudge.domain.enums.Visibility;
import dev.craftnudge.domain.valueobject.ChangedFile;
import dev.craftnudge.domain.valueobject.NormalizedCommit;
import dev.craftnudge.exception.MalformedPayloadException;
import dev.craftnudge.support.Payloads;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventNormalizerTest {

  private final EventNormalizer normalizer = new EventNormalizer(new ObjectMapper());

  private static IngestionEvent event(String type, String payload) {
    return IngestionEvent.create(EventSource.WEBHOOK, "delivery-1", type, payload, Instant.EPOCH);
  }

  @Nested
  @DisplayName("push events")
  class Push {

    @Test
    @DisplayName("yields one commit per payload commit, in payload order")
    void preservesOrder() {
      List<NormalizedCommit> commits = normalizer.normalize(event("push", Payloads.push("octo", "widgets", "c1", "c2", "c3")));

      assertThat(commits).extracting(c -> c.commit().hash()).containsExactly("c1", "c2", "c3");
      NormalizedCommit first = commits.get(0);
      assertThat(first.repository().owner()).isEqualTo("octo");
      assertThat(first.repository().name()).isEqualTo("widgets");
      assertThat(first.repository().language()).isEqualTo("Java");
      assertThat(first.repository().visibility()).isEqualTo(Visibility.PUBLIC);
      assertThat(first.commit().branch()).isEqualTo("main");
      assertThat(first.commit().author()).isEqualTo("Mona Lisa");
      assertThat(first.commit().committedAt()).isEqualTo(Instant.parse("2024-05-01T08:00:00Z"));
      assertThat(first.commit().metadata())
          .containsEntry("pusher", "mona")
          .containsEntry("headCommit", "c3")
          .containsEntry("deliveryId", "delivery-1")
          .containsEntry("source", "WEBHOOK");
    }

    @Test
    @DisplayName("maps added, modified and removed files in that order")
    void mapsFileLists() {
      String payload = """
          {
            "ref": "refs/heads/feature/login",
            "repository": { "name": "widgets", "full_name": "octo/widgets", "owner": { "name": "octo" } },
            "commits": [{
              "id": "abc123",
              "message": "Login form",
              "timestamp": "2024-05-01T10:00:00Z",
              "author": { "username": "mona" },
              "added": ["a.txt"],
              "modified": ["b.txt"],
              "removed": ["c.txt"]
            }]
          }
          """;

      NormalizedCommit commit = normalizer.normalize(event("push", payload)).get(0);

      assertThat(commit.commit().changedFiles()).containsExactly(
          new ChangedFile("a.txt", ChangeKind.ADDED),
          new ChangedFile("b.txt", ChangeKind.MODIFIED),
          new ChangedFile("c.txt", ChangeKind.DELETED));
      assertThat(commit.commit().branch()).isEqualTo("feature/login");
      assertThat(commit.commit().author()).isEqualTo("mona");
      assertThat(commit.repository().owner()).isEqualTo("octo");
      assertThat(commit.repository().visibility()).isNull();
    }

    @Test
    @DisplayName("push without commits yields nothing")
    void emptyPush() {
      assertThat(normalizer.normalize(event("push", Payloads.push("octo", "widgets")))).isEmpty();
    }

    @Test
    @DisplayName("is deterministic")
    void deterministic() {
      IngestionEvent event = event("push", Payloads.push("octo", "widgets", "c1", "c2"));

      assertThat(normalizer.normalize(event)).isEqualTo(normalizer.normalize(event));
    }

    @Test
    @DisplayName("cuts descriptive fields to their column size")
    void truncatesDescriptiveFields() {
      String payload = """
          {
            "ref": "refs/heads/%s",
            "repository": { "name": "widgets", "full_name": "octo/widgets", "language": "%s",
                            "description": "%s" },
            "commits": [{ "id": "abc123", "author": { "name": "%s" } }]
          }
          """.formatted("b".repeat(300), "L".repeat(150), "d".repeat(2500), "m".repeat(400));

      NormalizedCommit commit = normalizer.normalize(event("push", payload)).get(0);

      assertThat(commit.commit().hash()).isEqualTo("abc123");
      assertThat(commit.commit().branch()).hasSize(255);
      assertThat(commit.commit().author()).hasSize(255);
      assertThat(commit.repository().language()).hasSize(100);
      assertThat(commit.repository().description()).hasSize(2000);
    }
  }

  @Nested
  @DisplayName("polled commits")
  class Polled {

    @Test
    @DisplayName("maps upstream file statuses")
    void mapsStatuses() {
      IngestionEvent event = IngestionEvent.create(EventSource.POLL, "poll:octo/widgets:abc123", "commit",
          Payloads.polled("octo", "widgets", "abc123"), Instant.EPOCH);

      List<NormalizedCommit> commits = normalizer.normalize(event);

      assertThat(commits).singleElement().satisfies(c -> {
        assertThat(c.commit().hash()).isEqualTo("abc123");
        assertThat(c.commit().branch()).isEqualTo("main");
        assertThat(c.commit().changedFiles()).extracting(ChangedFile::changeKind)
            .containsExactly(ChangeKind.MODIFIED, ChangeKind.DELETED);
        assertThat(c.commit().metadata()).containsEntry("source", "POLL");
      });
    }
  }

  @Nested
  @DisplayName("pull request events")
  class PullRequests {

    @Test
    @DisplayName("opened pull request yields its head commit keyed by the head sha")
    void headCommit() {
      List<NormalizedCommit> commits = normalizer.normalize(
          event("pull_request", Payloads.pullRequest("octo", "widgets", "opened", 7, "abc123")));

      assertThat(commits).singleElement().satisfies(c -> {
        assertThat(c.repository().fullName()).isEqualTo("octo/widgets");
        assertThat(c.repository().visibility()).isEqualTo(Visibility.PRIVATE);
        assertThat(c.commit().hash()).isEqualTo("abc123");
        assertThat(c.commit().author()).isEqualTo("mona");
        assertThat(c.commit().branch()).isEqualTo("feature/login");
        assertThat(c.commit().changedFiles()).isEmpty();
        assertThat(c.commit().metadata())
            .containsEntry("pullRequest", 7)
            .containsEntry("action", "opened")
            .containsEntry("title", "Add login form")
            .containsEntry("baseSha", "base000")
            .containsEntry("baseBranch", "main");
      });
    }

    @Test
    @DisplayName("synchronize and reopened also move the head")
    void headChangingActions() {
      assertThat(normalizer.normalize(event("pull_request",
          Payloads.pullRequest("octo", "widgets", "synchronize", 7, "def456")))).hasSize(1);
      assertThat(normalizer.normalize(event("pull_request",
          Payloads.pullRequest("octo", "widgets", "reopened", 7, "def456")))).hasSize(1);
    }

    @Test
    @DisplayName("closed, labeled and other actions yield nothing")
    void otherActions() {
      assertThat(normalizer.normalize(event("pull_request",
          Payloads.pullRequest("octo", "widgets", "closed", 7, "abc123")))).isEmpty();
      assertThat(normalizer.normalize(event("pull_request",
          Payloads.pullRequest("octo", "widgets", "labeled", 7, "abc123")))).isEmpty();
    }

    @Test
    @DisplayName("pull request without head sha is malformed")
    void missingHead() {
      String payload = """
          { "action": "opened",
            "pull_request": { "number": 7, "head": { "ref": "feature/login" } },
            "repository": { "name": "widgets", "full_name": "octo/widgets" } }
          """;
      assertThatThrownBy(() -> normalizer.normalize(event("pull_request", payload)))
          .isInstanceOf(MalformedPayloadException.class)
          .hasMessageContaining("head sha");
    }

    @Test
    @DisplayName("pull_request delivery without the pull request object is malformed")
    void missingPullRequest() {
      String payload = """
          { "action": "opened", "repository": { "name": "widgets", "full_name": "octo/widgets" } }
          """;
      assertThatThrownBy(() -> normalizer.normalize(event("pull_request", payload)))
          .isInstanceOf(MalformedPayloadException.class);
    }
  }

  @Nested
  @DisplayName("malformed input")
  class Malformed {

    @Test
    @DisplayName("invalid JSON")
    void invalidJson() {
      assertThatThrownBy(() -> normalizer.normalize(event("push", "{\"ref\": ")))
          .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    @DisplayName("unsupported event type")
    void unsupportedType() {
      assertThatThrownBy(() -> normalizer.normalize(event("issues", "{}")))
          .isInstanceOf(MalformedPayloadException.class)
          .hasMessageContaining("issues");
    }

    @Test
    @DisplayName("missing repository identity")
    void missingRepository() {
      assertThatThrownBy(() -> normalizer.normalize(event("push", "{\"ref\":\"refs/heads/main\",\"commits\":[]}")))
          .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    @DisplayName("commit without id")
    void missingCommitId() {
      String payload = """
          { "repository": { "name": "w", "full_name": "o/w" }, "commits": [{ "message": "x" }] }
          """;
      assertThatThrownBy(() -> normalizer.normalize(event("push", payload)))
          .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    @DisplayName("unparsable timestamp")
    void badTimestamp() {
      String payload = """
          { "repository": { "name": "w", "full_name": "o/w" },
            "commits": [{ "id": "abc", "timestamp": "yesterday" }] }
          """;
      assertThatThrownBy(() -> normalizer.normalize(event("push", payload)))
          .isInstanceOf(MalformedPayloadException.class)
          .hasMessageContaining("yesterday");
    }

    @Test
    @DisplayName("commit id longer than 64 characters")
    void oversizeCommitId() {
      String longId = "a".repeat(65);
      assertThatThrownBy(() -> normalizer.normalize(event("push", Payloads.push("octo", "widgets", longId))))
          .isInstanceOf(MalformedPayloadException.class)
          .hasMessageContaining("commit id");
    }

    @Test
    @DisplayName("repository owner longer than 255 characters")
    void oversizeOwner() {
      String longOwner = "o".repeat(256);
      assertThatThrownBy(() -> normalizer.normalize(event("commit", Payloads.polled(longOwner, "widgets", "abc123"))))
          .isInstanceOf(MalformedPayloadException.class)
          .hasMessageContaining("repository owner");
    }
  }
}
