/**
 * Carrier audio format and the G.711 mu-law codec.
 *
 * <p>The carrier speaks 8 kHz, 8-bit mu-law mono; recognizers take 16-bit signed little-endian PCM
 * at 8 or 16 kHz. {@link com.phillippitts.frontdesk.service.audio.MulawCodec} converts between
 * them and resamples by duplication (up) or pairwise averaging (down).
 */
package com.phillippitts.frontdesk.service.audio;
