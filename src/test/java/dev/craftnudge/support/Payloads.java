package dev.craftnudge.support;

/**
 * Webhook and poll payload fixtures.
 */
public final class Payloads {

    private Payloads() {}

    public static String push(String owner, String name, String... commitIds) {
        StringBuilder commits = new StringBuilder();
        for (int i = 0; i < commitIds.length; i++) {
            if (i > 0) commits.append(',');
            commits.append("""
                    {
                      "id": "%s",
                      "message": "Change %d",
                      "timestamp": "2024-05-01T10:0%d:00+02:00",
                      "url": "https://github.com/%s/%s/commit/%s",
                      "author": { "name": "Mona Lisa", "username": "mona" },
                      "added": ["src/New%d.java"],
                      "modified": ["README.md"],
                      "removed": []
                    }
                    """.formatted(commitIds[i], i, i % 10, owner, name, commitIds[i], i));
        }
        return """
                {
                  "ref": "refs/heads/main",
                  "repository": {
                    "name": "%s",
                    "full_name": "%s/%s",
                    "owner": { "login": "%s", "name": "%s" },
                    "description": "Widgets for everyone",
                    "language": "Java",
                    "private": false
                  },
                  "pusher": { "name": "mona" },
                  "head_commit": %s,
                  "commits": [%s]
                }
                """.formatted(name, owner, name, owner, owner,
                commitIds.length == 0 ? "null" : "{ \"id\": \"" + commitIds[commitIds.length - 1] + "\" }",
                commits);
    }

    public static String polled(String owner, String name, String sha) {
        return """
                {
                  "repository": { "owner": "%s", "name": "%s", "language": "Java", "private": false },
                  "commit": {
                    "sha": "%s",
                    "message": "Polled change",
                    "author": "Mona Lisa",
                    "timestamp": "2024-05-01T08:00:00Z",
                    "url": "https://github.com/%s/%s/commit/%s",
                    "branch": "main",
                    "files": [
                      { "filename": "src/App.java", "status": "modified" },
                      { "filename": "docs/old.md", "status": "removed" }
                    ]
                  }
                }
                """.formatted(owner, name, sha, owner, name, sha);
    }

    public static String pullRequest(String owner, String name, String action, int number, String headSha) {
        return """
                {
                  "action": "%s",
                  "number": %d,
                  "pull_request": {
                    "number": %d,
                    "title": "Add login form",
                    "state": "open",
                    "html_url": "https://github.com/%s/%s/pull/%d",
                    "user": { "login": "mona" },
                    "head": { "sha": "%s", "ref": "feature/login" },
                    "base": { "sha": "base000", "ref": "main" }
                  },
                  "repository": {
                    "name": "%s",
                    "full_name": "%s/%s",
                    "owner": { "login": "%s" },
                    "language": "Java",
                    "private": true
                  }
                }
                """.formatted(action, number, number, owner, name, number, headSha, name, owner, name, owner);
    }
}
