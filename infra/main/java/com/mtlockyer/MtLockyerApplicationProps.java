package com.mtlockyer;

public class MtLockyerApplicationProps {
    // Fields match cdk.json context keys (camelCase). Environment overrides are applied in MtLockyerApplication.
    public String name;
    public String accountId;
    public String region;
    public String applicationTag;
    public String emailNotification;
    public String siteUn;
    public String s3Bucket;
    public String s3ObjectKey;
    public String secretsMgrArn;
    public String scheduleRateMinutes;
    public String functionImageDirectory;

    public static class Builder {
        private final MtLockyerApplicationProps p = new MtLockyerApplicationProps();

        public static Builder create() {
            return new Builder();
        }

        public MtLockyerApplicationProps build() {
            return p;
        }

        public Builder set(String key, String value) {
            try {
                var f = MtLockyerApplicationProps.class.getDeclaredField(key);
                f.setAccessible(true);
                f.set(p, value);
            } catch (NoSuchFieldException | IllegalAccessException e) {
                throw new IllegalArgumentException("Unknown application property " + key, e);
            }
            return this;
        }
    }
}
