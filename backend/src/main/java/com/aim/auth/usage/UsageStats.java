package com.aim.auth.usage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response for GET /admin/usage-stats
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageStats {

    private long totalUsers;
    private long activeUsers;
    private int days;

    /** One entry per calendar day (UTC), most recent first */
    private List<DailyUsage> dailyStats;

    /** Up to 10 heaviest callers in the window */
    private List<UserUsage> topUsers;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyUsage {
        private String date;
        private long calls;
        private long users;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserUsage {
        private String username;
        private long calls;
    }
}
