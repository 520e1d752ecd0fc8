package com.consullo.cursorlist.demo;

import com.consullo.cursorlist.CursorList;
import com.consullo.cursorlist.cursor.CursorState;
import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a small playlist through bounded and rotating navigation and prints each step to stdout.
 *
 * <p>Covers: bounded moves hitting both ends, repeat mode (rotation), removing tracks through
 * {@link CursorList#modify}, and a stale read after a direct edit followed by resynchronization.
 *
 * @since 1.0
 */
public final class PlaylistDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaylistDemo.class);

  private PlaylistDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   */
  public static void main(final String[] args) {
    final PrintStream out = System.out;

    final CursorList<String> playlist = new CursorList<String>()
            .withContainer(List.of("intro", "verse", "chorus", "bridge", "outro"));
    LOGGER.info("Loaded playlist with {} tracks", playlist.size());

    out.println("=== Bounded playback ===");
    out.println("now playing: " + playlist.getCurrent());
    CursorState<String> state = playlist.moveNextAndGet();
    while (state.isValid()) {
      out.println("next: " + state);
      state = playlist.moveNextAndGet();
    }
    out.println("stopped at end: " + state);
    out.println("skip back 2: " + playlist.movePrevNthAndGet(2));

    out.println("=== Repeat mode ===");
    playlist.setRotatable(true);
    out.println("next after wrap: " + playlist.moveNextNthAndGet(3));
    out.println("previous after wrap: " + playlist.movePrevAndGet());

    out.println("=== Remove short titles ===");
    playlist.modify(tracks -> tracks.removeIf(t -> t.length() <= 5));
    out.println("playlist: " + playlist.container());
    out.println("now playing: " + playlist.getCurrent() + " at " + playlist.getCursor());

    out.println("=== Direct edit without resync ===");
    playlist.container().clear();
    playlist.container().add("encore");
    out.println("stale read: " + playlist.getCurrent());
    playlist.updateCursor();
    out.println("after updateCursor: " + playlist.getCurrent());

    out.flush();
    LOGGER.info("Demo completed");
  }
}
