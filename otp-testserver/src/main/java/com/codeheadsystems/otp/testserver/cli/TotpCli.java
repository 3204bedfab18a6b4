package com.codeheadsystems.otp.testserver.cli;

import com.codeheadsystems.otp.rfc.common.OtpException;
import com.codeheadsystems.otp.rfc.hotp.Counter;
import com.codeheadsystems.otp.rfc.hotp.HotpGenerator;
import com.codeheadsystems.otp.rfc.totp.TotpConfig;
import com.codeheadsystems.otp.rfc.totp.TotpCounterDerivation;
import com.codeheadsystems.otp.rfc.verify.VerificationResult;
import com.codeheadsystems.otp.rfc.verify.Verifier;
import com.codeheadsystems.otp.server.config.TotpServerConfig;
import com.codeheadsystems.otp.server.manager.TotpServerManager;
import com.codeheadsystems.otp.server.model.RegistrationResult;
import com.codeheadsystems.otp.server.store.InMemoryCredentialStore;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.codec.binary.Base32;

/**
 * Command-line TOTP tool for provisioning an authenticator app and checking its codes.
 *
 * <pre>
 * Usage:
 *   TotpCli register &lt;label&gt; [--issuer &lt;issuer&gt;] [--out &lt;file.html&gt;]
 *   TotpCli code &lt;base32-secret&gt; [--digits n] [--period s]
 *   TotpCli verify &lt;base32-secret&gt; &lt;code&gt; [--digits n] [--period s] [--drift d] [--threshold t]
 * </pre>
 *
 * <p>{@code register} prints the secret and the otpauth uri and writes an HTML page with the QR
 * code. Scan it, then run {@code verify} with the code the app shows.
 */
public class TotpCli {

  private static final String DEFAULT_ISSUER = "otp-testserver";
  private static final String DEFAULT_OUT = "totp.html";

  private final PrintStream out;
  private final PrintStream err;
  private final Clock clock;

  public TotpCli(final PrintStream out, final PrintStream err, final Clock clock) {
    this.out = out;
    this.err = err;
    this.clock = clock;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    int status = new TotpCli(System.out, System.err, Clock.systemUTC()).run(args);
    System.exit(status);
  }

  /**
   * Runs a command.
   *
   * @param args command-line arguments
   * @return the process exit status
   */
  public int run(String[] args) {
    List<String> positional = new ArrayList<>();
    Map<String, String> options = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      if (args[i].startsWith("--")) {
        if (i + 1 == args.length) {
          err.println("Error: missing value for " + args[i]);
          return usage();
        }
        options.put(args[i].substring(2), args[++i]);
      } else if (!args[i].startsWith("-")) {
        positional.add(args[i]);
      }
    }
    if (positional.isEmpty()) {
      return usage();
    }
    try {
      TotpConfig config = config(options);
      switch (positional.get(0)) {
        case "register":
          return positional.size() == 2 ? register(positional.get(1), options, config) : usage();
        case "code":
          return positional.size() == 2 ? code(positional.get(1), config) : usage();
        case "verify":
          return positional.size() == 3 ? verify(positional.get(1), positional.get(2), config) : usage();
        default:
          return usage();
      }
    } catch (IllegalArgumentException | OtpException | IOException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private int register(String label, Map<String, String> options, TotpConfig config) throws IOException {
    String issuer = options.getOrDefault("issuer", DEFAULT_ISSUER);
    TotpServerManager manager = new TotpServerManager(
        new TotpServerConfig(issuer, config), new InMemoryCredentialStore());
    RegistrationResult result = manager.register(label, label);

    Path page = Path.of(options.getOrDefault("out", DEFAULT_OUT));
    Files.writeString(page,
        "<html><head></head><body><h1>TOTP QR code</h1>" + result.qrCodeSvg() + "</body></html>",
        StandardCharsets.UTF_8);

    out.println("Issuer : " + issuer);
    out.println("Label  : " + label);
    out.println("Secret : " + result.base32Secret());
    out.println("URI    : " + result.uri());
    out.println("QR code: " + page.toAbsolutePath());
    return 0;
  }

  private int code(String base32Secret, TotpConfig config) {
    byte[] secret = decodeSecret(base32Secret);
    Counter counter = new TotpCounterDerivation(config.withDrift(0), clock).currentCounter();
    out.println(HotpGenerator.format(HotpGenerator.hotp(secret, counter, config.digits()), config.digits()));
    return 0;
  }

  private int verify(String base32Secret, String code, TotpConfig config) {
    byte[] secret = decodeSecret(base32Secret);
    if (code.length() != config.digits() || !code.chars().allMatch(c -> c >= '0' && c <= '9')) {
      err.println("Error: code must have exactly " + config.digits() + " digits");
      return 1;
    }
    VerificationResult result = Verifier.verify(secret, Integer.parseInt(code), config, clock.instant().getEpochSecond());
    if (result.isRejected()) {
      err.println(result.error().description());
      return 1;
    }
    out.println("Valid code. Drift: " + result.steps() + " steps");
    return 0;
  }

  private static TotpConfig config(Map<String, String> options) {
    TotpConfig config = TotpConfig.DEFAULT;
    if (options.containsKey("digits")) {
      config = config.withDigits(Integer.parseInt(options.get("digits")));
    }
    if (options.containsKey("period")) {
      config = config.withPeriod(Long.parseLong(options.get("period")));
    }
    if (options.containsKey("drift")) {
      config = config.withDrift(Long.parseLong(options.get("drift")));
    }
    if (options.containsKey("threshold")) {
      config = config.withThreshold(Integer.parseInt(options.get("threshold")));
    }
    return config;
  }

  private static byte[] decodeSecret(String base32Secret) {
    Base32 base32 = new Base32();
    if (!base32.isInAlphabet(base32Secret.toUpperCase())) {
      throw new IllegalArgumentException("Secret is not Base32");
    }
    return base32.decode(base32Secret.toUpperCase());
  }

  private int usage() {
    err.println("Usage: TotpCli register <label> [--issuer <issuer>] [--out <file.html>]");
    err.println("       TotpCli code <base32-secret> [--digits n] [--period s]");
    err.println("       TotpCli verify <base32-secret> <code> [--digits n] [--period s] [--drift d] [--threshold t]");
    return 1;
  }
}
