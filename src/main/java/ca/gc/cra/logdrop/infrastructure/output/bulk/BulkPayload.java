package ca.gc.cra.logdrop.infrastructure.output.bulk;

import java.util.List;

/** Builds newline-delimited bulk index bodies. */
final class BulkPayload {
  static final String INDEX_HEADER = "{\"index\":{}}\n";

  private BulkPayload() {}

  /**
   * Pairs every serialized document with an index action line.
   *
   * @param documents serialized records in order
   * @return bulk body, each document followed by {@code \n}
   */
  static String of(List<String> documents) {
    int size = 0;
    for (String document : documents) {
      size += INDEX_HEADER.length() + document.length() + 1;
    }
    StringBuilder body = new StringBuilder(size);
    for (String document : documents) {
      body.append(INDEX_HEADER).append(document).append('\n');
    }
    return body.toString();
  }
}
