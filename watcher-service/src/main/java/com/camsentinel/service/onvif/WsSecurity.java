package com.camsentinel.service.onvif;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;

/**
 * WS-Security UsernameToken with password digest, as required by ONVIF
 * devices for authenticated SOAP calls.
 *
 * <pre>
 *   PasswordDigest = Base64( SHA-1( nonce + created + password ) )
 * </pre>
 */
final class WsSecurity {

    static final String WSSE_NS =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-secext-1.0.xsd";
    static final String WSU_NS =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-utility-1.0.xsd";
    private static final String PASSWORD_DIGEST_TYPE =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-username-token-profile-1.0#PasswordDigest";
    private static final String BASE64_ENCODING =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-soap-message-security-1.0#Base64Binary";

    private static final SecureRandom RANDOM = new SecureRandom();

    private WsSecurity() {
    }

    /**
     * Render the {@code wsse:Security} header block for one request.
     *
     * @param username device user
     * @param password device password
     * @param now      token creation time
     * @return the header XML fragment
     */
    static String securityHeader(String username, String password, Instant now) {
        byte[] nonce = new byte[16];
        RANDOM.nextBytes(nonce);
        String created = now.truncatedTo(ChronoUnit.SECONDS).toString();
        String digest = passwordDigest(nonce, created, password);

        return "<wsse:Security s:mustUnderstand=\"1\" xmlns:wsse=\"" + WSSE_NS + "\" xmlns:wsu=\"" + WSU_NS + "\">"
                + "<wsse:UsernameToken>"
                + "<wsse:Username>" + SoapEnvelope.escape(username) + "</wsse:Username>"
                + "<wsse:Password Type=\"" + PASSWORD_DIGEST_TYPE + "\">" + digest + "</wsse:Password>"
                + "<wsse:Nonce EncodingType=\"" + BASE64_ENCODING + "\">"
                + Base64.getEncoder().encodeToString(nonce) + "</wsse:Nonce>"
                + "<wsu:Created>" + created + "</wsu:Created>"
                + "</wsse:UsernameToken>"
                + "</wsse:Security>";
    }

    /**
     * @param nonce    raw nonce bytes
     * @param created  creation timestamp exactly as sent
     * @param password clear-text password
     * @return Base64 encoded SHA-1 digest
     */
    static String passwordDigest(byte[] nonce, String created, String password) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            sha1.update(nonce);
            sha1.update(created.getBytes(StandardCharsets.UTF_8));
            sha1.update(password.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(sha1.digest());
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
