package com.tenantgate.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Verifies RS256 bearer tokens issued by the tenant-management backend.
 */
public class JwtTokenVerifier {

    private final PublicKey publicKey;
    private final String issuer;

    public JwtTokenVerifier(PublicKey publicKey, String issuer) {
        this.publicKey = publicKey;
        this.issuer = issuer;
    }

    public static JwtTokenVerifier fromProperties(SecurityProperties properties) {
        if (properties.getJwtPublicKey() == null || properties.getJwtPublicKey().isBlank()) {
            throw new IllegalStateException("tenantgate.security.jwt.public-key is required when JWT auth is enabled");
        }
        return new JwtTokenVerifier(parsePublicKey(properties.getJwtPublicKey()), properties.getJwtIssuer());
    }

    /**
     * @throws io.jsonwebtoken.JwtException if the token is malformed, expired, badly signed or from another issuer
     */
    public Claims verify(String token) {
        var parser = Jwts.parser().verifyWith(publicKey);
        if (issuer != null && !issuer.isBlank()) {
            parser.requireIssuer(issuer);
        }
        return parser.build()
                .parseSignedClaims(token)
                .getPayload();
    }

    static PublicKey parsePublicKey(String pem) {
        String base64 = pem
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s", "");
        try {
            return KeyFactory.getInstance("RSA")
                    .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(base64)));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid RSA public key for JWT verification", e);
        }
    }
}
