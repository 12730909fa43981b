package com.flamingo.ai.semanticquery.stream;

import com.flamingo.ai.semanticquery.exception.StreamDecodingException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 decoder for a byte stream that arrives in arbitrary chunks.
 *
 * <p>Bytes of a multi-byte sequence cut by a chunk boundary are held back and completed by the next
 * chunk, so decoding is done against the continuous stream rather than chunk by chunk. Malformed
 * input fails immediately; a sequence still incomplete when the stream ends fails in {@link
 * #finish()}.
 */
public class IncrementalTextDecoder {

  private final CharsetDecoder decoder =
      StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT);

  private byte[] pending = new byte[0];
  private long bytesConsumed;

  /**
   * Decodes the next chunk.
   *
   * @param chunk bytes just received
   * @return the text that could be completed with this chunk, possibly empty
   * @throws StreamDecodingException if the bytes are not valid UTF-8
   */
  public String decode(byte[] chunk) {
    ByteBuffer in = ByteBuffer.allocate(pending.length + chunk.length);
    in.put(pending).put(chunk).flip();
    String text = run(in, false);

    pending = new byte[in.remaining()];
    in.get(pending);
    bytesConsumed += chunk.length;
    return text;
  }

  /**
   * Completes decoding at end of stream.
   *
   * @return any final text
   * @throws StreamDecodingException if the stream ended inside a multi-byte sequence
   */
  public String finish() {
    ByteBuffer in = ByteBuffer.wrap(pending);
    String text = run(in, true);
    CharBuffer out = CharBuffer.allocate(4);
    CoderResult result = decoder.flush(out);
    if (result.isError()) {
      throw new StreamDecodingException(bytesConsumed, "Invalid UTF-8 at end of stream");
    }
    pending = new byte[0];
    return text + out.flip();
  }

  private String run(ByteBuffer in, boolean endOfInput) {
    CharBuffer out = CharBuffer.allocate((int) (in.remaining() * decoder.maxCharsPerByte()) + 1);
    StringBuilder text = new StringBuilder();
    while (true) {
      CoderResult result = decoder.decode(in, out, endOfInput);
      if (result.isError()) {
        long position = bytesConsumed - pending.length + in.position();
        throw new StreamDecodingException(
            position, "Invalid UTF-8 sequence near byte offset " + position + ": " + result);
      }
      if (result.isOverflow()) {
        text.append(out.flip());
        out.clear();
        continue;
      }
      break;
    }
    return text.append(out.flip()).toString();
  }

  /** Total bytes handed to {@link #decode(byte[])} so far. */
  public long bytesConsumed() {
    return bytesConsumed;
  }
}
