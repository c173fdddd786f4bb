package com.tenantgate.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "tenantgate.security")
public class SecurityProperties {

    private Jwt jwt = new Jwt();

    public boolean isJwtEnabled() { return jwt.enabled; }
    public String getJwtPublicKey() { return jwt.publicKey; }
    public String getJwtIssuer() { return jwt.issuer; }
    public List<String> getProtectedPrefixes() { return jwt.protectedPrefixes; }

    public Jwt getJwt() { return jwt; }
    public void setJwt(Jwt jwt) { this.jwt = jwt; }

    public static class Jwt {
        private boolean enabled = false;
        /** PEM or bare base64 X.509 encoding of the RSA verification key. */
        private String publicKey;
        private String issuer;
        private List<String> protectedPrefixes = List.of("/chat", "/sessions", "/ws/");

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getPublicKey() { return publicKey; }
        public void setPublicKey(String publicKey) { this.publicKey = publicKey; }
        public String getIssuer() { return issuer; }
        public void setIssuer(String issuer) { this.issuer = issuer; }
        public List<String> getProtectedPrefixes() { return protectedPrefixes; }
        public void setProtectedPrefixes(List<String> protectedPrefixes) { this.protectedPrefixes = protectedPrefixes; }
    }
}
