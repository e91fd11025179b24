package io.kubetest.k8s;

/**
 * Version reported by the API server.
 */
public class ClusterVersion {

    private final String gitVersion;
    private final String major;
    private final String minor;

    public ClusterVersion(String gitVersion, String major, String minor) {
        this.gitVersion = gitVersion;
        this.major = major;
        this.minor = minor;
    }

    public String getGitVersion() {
        return gitVersion;
    }

    public String getMajor() {
        return major;
    }

    public String getMinor() {
        return minor;
    }

    /**
     * Minor version reduced to its leading digits, managed clusters report values like {@code 28+}.
     */
    public String getMinorDigits() {
        return leadingDigits(minor);
    }

    public String getMajorDigits() {
        return leadingDigits(major);
    }

    /**
     * @return true when the cluster is at least {@code major.minor}, parts without digits count as 0
     */
    public boolean isAtLeast(int wantedMajor, int wantedMinor) {
        int actualMajor = toInt(getMajorDigits());
        int actualMinor = toInt(getMinorDigits());
        return actualMajor > wantedMajor || (actualMajor == wantedMajor && actualMinor >= wantedMinor);
    }

    private static int toInt(String digits) {
        return digits.isEmpty() ? 0 : Integer.parseInt(digits);
    }

    private static String leadingDigits(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder digits = new StringBuilder();
        for (char c : value.toCharArray()) {
            if (!Character.isDigit(c)) {
                break;
            }
            digits.append(c);
        }
        return digits.toString();
    }

    @Override
    public String toString() {
        return gitVersion != null ? gitVersion : major + "." + minor;
    }
}
