package com.aim.auth.usage;

import com.aim.auth.model.UsageRecord;
import com.aim.auth.model.User;
import com.aim.auth.store.UserStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Aggregates usage records into per-day and per-user counts.
 */
@Service
@RequiredArgsConstructor
public class UsageStatsService {

    static final int TOP_USERS_LIMIT = 10;

    private final UserStore userStore;
    private final Clock clock;

    /**
     * @param days window size; records from the start of (today - days) UTC onward are counted
     */
    public UsageStats usageStats(int days) {
        Instant since = LocalDate.now(clock.withZone(ZoneOffset.UTC))
                .minusDays(days)
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
        List<UsageRecord> records = userStore.findUsageSince(since);

        Map<LocalDate, List<UsageRecord>> byDay = records.stream()
                .collect(Collectors.groupingBy(
                        r -> r.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate(),
                        () -> new TreeMap<LocalDate, List<UsageRecord>>(Comparator.reverseOrder()),
                        Collectors.toList()));

        List<UsageStats.DailyUsage> daily = byDay.entrySet().stream()
                .map(e -> UsageStats.DailyUsage.builder()
                        .date(e.getKey().toString())
                        .calls(e.getValue().size())
                        .users(e.getValue().stream().map(UsageRecord::getUserId).distinct().count())
                        .build())
                .collect(Collectors.toList());

        Map<String, String> usernames = userStore.list().stream()
                .collect(Collectors.toMap(User::getId, User::getUsername));

        List<UsageStats.UserUsage> top = records.stream()
                .collect(Collectors.groupingBy(UsageRecord::getUserId, Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(TOP_USERS_LIMIT)
                .map(e -> UsageStats.UserUsage.builder()
                        .username(usernames.getOrDefault(e.getKey(), e.getKey()))
                        .calls(e.getValue())
                        .build())
                .collect(Collectors.toList());

        return UsageStats.builder()
                .totalUsers(userStore.count())
                .activeUsers(userStore.countActive())
                .days(days)
                .dailyStats(daily)
                .topUsers(top)
                .build();
    }

    /** Calls made by one user since the start of today (UTC). */
    public long callsToday(String userId) {
        Instant startOfDay = LocalDate.now(clock.withZone(ZoneOffset.UTC))
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
        return userStore.countUsageSince(userId, startOfDay);
    }
}
