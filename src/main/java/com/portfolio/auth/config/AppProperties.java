package com.portfolio.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix="app")
public class AppProperties {
    private Auth auth = new Auth();
    private Mfa mfa = new Mfa();
    private Cache cache = new Cache();

    public Auth getAuth(){ return auth; }
    public Mfa getMfa(){ return mfa; }
    public Cache getCache(){ return cache; }

    public static class Auth {
        private Lockout lockout = new Lockout();
        private Revocation revocation = new Revocation();
        private long userCacheTtlSeconds = 600;
        private long verificationTtlHours = 24;
        private long resetTtlMinutes = 60;
        private int bcryptStrength = 12;
        private String frontendUrl = "http://localhost:3000";

        public Lockout getLockout(){ return lockout; }
        public Revocation getRevocation(){ return revocation; }

        public long getUserCacheTtlSeconds(){ return userCacheTtlSeconds; }
        public void setUserCacheTtlSeconds(long userCacheTtlSeconds){ this.userCacheTtlSeconds = userCacheTtlSeconds; }

        public long getVerificationTtlHours(){ return verificationTtlHours; }
        public void setVerificationTtlHours(long verificationTtlHours){ this.verificationTtlHours = verificationTtlHours; }

        public long getResetTtlMinutes(){ return resetTtlMinutes; }
        public void setResetTtlMinutes(long resetTtlMinutes){ this.resetTtlMinutes = resetTtlMinutes; }

        public int getBcryptStrength(){ return bcryptStrength; }
        public void setBcryptStrength(int bcryptStrength){ this.bcryptStrength = bcryptStrength; }

        public String getFrontendUrl(){ return frontendUrl; }
        public void setFrontendUrl(String frontendUrl){ this.frontendUrl = frontendUrl; }
    }

    public static class Lockout {
        private int maxAttempts = 5;
        private long durationMinutes = 60;

        public int getMaxAttempts(){ return maxAttempts; }
        public void setMaxAttempts(int maxAttempts){ this.maxAttempts = maxAttempts; }

        public long getDurationMinutes(){ return durationMinutes; }
        public void setDurationMinutes(long durationMinutes){ this.durationMinutes = durationMinutes; }
    }

    /**
     * failOpen=true keeps serving requests while the cache is down, at the cost of
     * accepting revoked tokens for the duration of the outage. false rejects every
     * authenticated request instead.
     */
    public static class Revocation {
        private boolean failOpen = true;
        private long fallbackTtlSeconds = 3600;

        public boolean isFailOpen(){ return failOpen; }
        public void setFailOpen(boolean failOpen){ this.failOpen = failOpen; }

        public long getFallbackTtlSeconds(){ return fallbackTtlSeconds; }
        public void setFallbackTtlSeconds(long fallbackTtlSeconds){ this.fallbackTtlSeconds = fallbackTtlSeconds; }
    }

    public static class Mfa {
        private long setupTtlSeconds = 600;
        private long verifiedTtlSeconds = 3600;

        public long getSetupTtlSeconds(){ return setupTtlSeconds; }
        public void setSetupTtlSeconds(long setupTtlSeconds){ this.setupTtlSeconds = setupTtlSeconds; }

        public long getVerifiedTtlSeconds(){ return verifiedTtlSeconds; }
        public void setVerifiedTtlSeconds(long verifiedTtlSeconds){ this.verifiedTtlSeconds = verifiedTtlSeconds; }
    }

    public static class Cache {
        private String type = "redis";
        private long reconnectIntervalMs = 30000;

        public String getType(){ return type; }
        public void setType(String type){ this.type = type; }

        public long getReconnectIntervalMs(){ return reconnectIntervalMs; }
        public void setReconnectIntervalMs(long reconnectIntervalMs){ this.reconnectIntervalMs = reconnectIntervalMs; }
    }
}
