package deparse;

import com.google.common.base.Strings;

/**
 * Output text for one scope. Newlines are held back until real text follows, and a run of pending
 * newlines never grows past the longest run any single write asked for.
 */
final class SourceBuffer {
  private final StringBuilder text = new StringBuilder();
  private int pendingNewlines = 0;
  private int longestRequest = 0;

  void write(String data) {
    if (data.isEmpty()) return;

    int leading = 0;
    while (leading < data.length() && data.charAt(leading) == '\n') {
      leading++;
    }
    if (leading == data.length()) {
      requestNewlines(leading);
      return;
    }
    if (leading > 0) {
      requestNewlines(leading);
    }

    int end = data.length();
    while (end > leading && data.charAt(end - 1) == '\n') {
      end--;
    }
    flushPending();
    text.append(data, leading, end);
    if (end < data.length()) {
      requestNewlines(data.length() - end);
    }
  }

  // Makes sure what follows starts on a new line.
  void endLine() {
    longestRequest = Math.max(longestRequest, 1);
    pendingNewlines = Math.max(pendingNewlines, 1);
  }

  int column() {
    if (pendingNewlines > 0) return 0;
    return text.length() - (text.lastIndexOf("\n") + 1);
  }

  int pendingNewlines() {
    return pendingNewlines;
  }

  String contents() {
    return text + Strings.repeat("\n", pendingNewlines);
  }

  private void requestNewlines(int count) {
    longestRequest = Math.max(longestRequest, count);
    pendingNewlines = Math.min(pendingNewlines + count, longestRequest);
  }

  private void flushPending() {
    text.append(Strings.repeat("\n", pendingNewlines));
    pendingNewlines = 0;
  }

  @Override
  public String toString() {
    return contents();
  }
}
