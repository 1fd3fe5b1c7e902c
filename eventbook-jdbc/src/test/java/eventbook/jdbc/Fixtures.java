package eventbook.jdbc;

import eventbook.model.EventDraft;
import eventbook.model.EventMode;
import eventbook.model.NormalizedEvent;
import org.h2.jdbcx.JdbcDataSource;

import java.util.List;
import java.util.UUID;

/**
 * Shared data and H2 helpers for tests.
 */
public final class Fixtures {

  private Fixtures() {
  }

  public static String h2Url(String prefix) {
    return "jdbc:h2:mem:" + prefix + "_" + UUID.randomUUID().toString().replace("-", "")
        + ";DB_CLOSE_DELAY=-1";
  }

  public static JdbcDataSource h2DataSource(String url) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL(url);
    return ds;
  }

  public static NormalizedEvent event(String title, String slug) {
    return new NormalizedEvent(title, slug, "Talks about " + title, "Overview",
        "https://cdn.example.com/" + slug + ".png", "Main Hall", "Berlin, DE", "2025-03-01", "18:30",
        EventMode.OFFLINE, "Developers", List.of("Doors open", "Talks \"live\""), "Meetup Org",
        List.of("java", "jdbc"));
  }

  public static EventDraft.Builder draft(String title) {
    return EventDraft.builder()
        .title(title)
        .description("Talks about " + title)
        .overview("Overview")
        .image("https://cdn.example.com/event.png")
        .venue("Main Hall")
        .location("Berlin, DE")
        .date("2025-03-01T18:30:00Z")
        .time("6:30 PM")
        .mode(EventMode.OFFLINE)
        .audience("Developers")
        .agenda(List.of("Doors open", "Talks"))
        .organizer("Meetup Org")
        .tags(List.of("java"));
  }
}
