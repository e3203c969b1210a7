package com.relevx.quota;

import com.relevx.domain.Frequency;
import com.relevx.domain.Plan;
import com.relevx.domain.Project;
import com.relevx.scheduling.ProjectSchedule;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Decides whether a set of active projects fits a plan's daily run budget.
 * <p>
 * Daily projects run every day; weekly projects land on their weekday, monthly ones on their day of month. A set is
 * admissible when the daily count, plus the busiest weekday or the busiest day of month, stays within maxDailyRuns.
 * Weekly and monthly buckets are checked separately and never summed. Stateless; order of the input does not matter.
 */
@Component
public class QuotaValidator {

    public boolean isAdmissible(Plan plan, Collection<Project> candidateActiveJobs) {
        return evaluate(plan.getMaxDailyRuns(), candidateActiveJobs).admissible();
    }

    public QuotaEvaluation evaluate(int maxDailyRuns, Collection<Project> jobs) {
        int dailyCount = 0;
        Map<Integer, Integer> weeklyBuckets = new HashMap<>();
        Map<Integer, Integer> monthlyBuckets = new HashMap<>();
        for (Project job : jobs) {
            if (job == null || job.getFrequency() == null) {
                continue;
            }
            switch (job.getFrequency()) {
                case DAILY -> dailyCount++;
                case WEEKLY -> {
                    if (job.getDayOfWeek() != null) {
                        weeklyBuckets.merge(job.getDayOfWeek(), 1, Integer::sum);
                    }
                }
                case MONTHLY -> {
                    if (job.getDayOfMonth() != null) {
                        monthlyBuckets.merge(job.getDayOfMonth(), 1, Integer::sum);
                    }
                }
            }
        }
        int peakWeekly = peak(weeklyBuckets);
        int peakMonthly = peak(monthlyBuckets);
        boolean admissible = dailyCount <= maxDailyRuns
                && peakWeekly + dailyCount <= maxDailyRuns
                && peakMonthly + dailyCount <= maxDailyRuns;
        return new QuotaEvaluation(admissible, maxDailyRuns, dailyCount, peakWeekly, peakMonthly);
    }

    /**
     * Projects carrying only the fields the validator reads, for a schedule that is not persisted yet.
     */
    public static Project candidate(ProjectSchedule schedule) {
        Project p = new Project();
        p.setFrequency(schedule.frequency());
        p.setDayOfWeek(schedule.frequency() == Frequency.WEEKLY ? schedule.dayOfWeek() : null);
        p.setDayOfMonth(schedule.frequency() == Frequency.MONTHLY ? schedule.dayOfMonth() : null);
        return p;
    }

    private static int peak(Map<Integer, Integer> buckets) {
        int max = 0;
        for (int count : buckets.values()) {
            max = Math.max(max, count);
        }
        return max;
    }
}
