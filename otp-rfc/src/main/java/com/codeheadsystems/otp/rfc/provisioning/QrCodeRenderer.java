package com.codeheadsystems.otp.rfc.provisioning;

import com.codeheadsystems.otp.rfc.common.OtpError;
import com.codeheadsystems.otp.rfc.common.OtpException;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import com.google.zxing.qrcode.encoder.ByteMatrix;
import com.google.zxing.qrcode.encoder.Encoder;
import com.google.zxing.qrcode.encoder.QRCode;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a provisioning URI as a QR code in SVG, suitable for inlining in an HTML page.
 * The image is 50mm square; the view box is one unit per module plus the quiet zone.
 */
public class QrCodeRenderer {

  private static final Logger log = LoggerFactory.getLogger(QrCodeRenderer.class);

  /**
   * Light modules required around the symbol, ISO/IEC 18004.
   */
  public static final int QUIET_ZONE = 4;

  // Labels and issuers may be outside Latin-1, ZXing's default byte-mode charset.
  private static final Map<EncodeHintType, Object> HINTS =
      Map.of(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());

  private final ErrorCorrectionLevel errorCorrectionLevel;

  public QrCodeRenderer() {
    this(ErrorCorrectionLevel.M);
  }

  public QrCodeRenderer(final ErrorCorrectionLevel errorCorrectionLevel) {
    this.errorCorrectionLevel = errorCorrectionLevel;
  }

  /**
   * Encodes the payload and renders it.
   *
   * @param payload the text to encode, usually {@link ProvisioningUri#toUri()}
   * @return an svg element
   * @throws OtpException with {@link OtpError#QR_CAPACITY_EXCEEDED} if the payload does not fit
   */
  public String toSvg(String payload) {
    return toSvg(encode(payload));
  }

  /**
   * Encodes the payload into a module matrix. Text is encoded as UTF-8 and flagged with an ECI
   * segment so readers decode it the same way.
   *
   * @param payload the text to encode
   * @return the matrix, 1 for dark modules
   */
  public ByteMatrix encode(String payload) {
    try {
      QRCode code = Encoder.encode(payload, errorCorrectionLevel, HINTS);
      log.debug("encode(): version {} for {} characters", code.getVersion().getVersionNumber(), payload.length());
      return code.getMatrix();
    } catch (WriterException e) {
      throw new OtpException(OtpError.QR_CAPACITY_EXCEEDED,
          "Payload of " + payload.length() + " characters does not fit in a QR code", e);
    }
  }

  String toSvg(ByteMatrix matrix) {
    int size = matrix.getWidth() + 2 * QUIET_ZONE;
    StringBuilder path = new StringBuilder();
    for (int y = 0; y < matrix.getHeight(); y++) {
      for (int x = 0; x < matrix.getWidth(); x++) {
        if (matrix.get(x, y) == 1) {
          path.append('M').append(x + QUIET_ZONE).append(',').append(y + QUIET_ZONE).append("h1v1h-1z");
        }
      }
    }
    return "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"50mm\" height=\"50mm\""
        + " viewBox=\"0 0 " + size + " " + size + "\">"
        + "<rect width=\"" + size + "\" height=\"" + size + "\" fill=\"white\"/>"
        + "<path fill=\"black\" d=\"" + path + "\"/>"
        + "</svg>";
  }
}
