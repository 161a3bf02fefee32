package com.hubrelay.webhooks.aggregation;

import com.hubrelay.webhooks.model.EventKind;
import com.hubrelay.webhooks.model.GitHubEvent;
import com.hubrelay.webhooks.model.IssueCommentEvent;
import com.hubrelay.webhooks.model.IssuesEvent;
import com.hubrelay.webhooks.model.PullRequestEvent;
import com.hubrelay.webhooks.model.action.CommentAction;
import com.hubrelay.webhooks.model.action.EventAction;
import com.hubrelay.webhooks.model.action.IssueAction;
import com.hubrelay.webhooks.model.action.PullRequestAction;
import com.hubrelay.webhooks.model.payload.Label;
import com.hubrelay.webhooks.model.payload.Milestone;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * How an aggregation started by a given (kind, action) absorbs later events.
 *
 * <p>Each policy has a starter, run once when the aggregation is created, and
 * a merge predicate deciding whether a later event of the same subscription
 * is folded in.  Events whose (kind, action) has no entry in the table are
 * never aggregated.
 */
public enum AggregationPolicy {

    /**
     * Folds labeled/unlabeled bursts on one issue or pull request into a single
     * {@code x_labels_changed} notification.
     */
    LABELS {
        @Override
        void start(PendingAggregation aggregation) {
            GitHubEvent event = aggregation.getRepresentative();
            applyLabel(aggregation.getAccumulator(), event);
            aggregation.switchAction(labelsChanged(event.getKind()));
        }

        @Override
        MergeResult merge(PendingAggregation aggregation, GitHubEvent event) {
            if (!sameSubject(aggregation.getRepresentative(), event) || labelOf(event) == null) {
                return MergeResult.REJECTED;
            }
            if (!isLabeled(event.getAction()) && !isUnlabeled(event.getAction())) {
                return MergeResult.REJECTED;
            }
            applyLabel(aggregation.getAccumulator(), event);
            return MergeResult.MERGED;
        }
    },

    /**
     * GitHub follows an "opened" event with one "labeled" event per label the
     * subject was created with.  Those carry nothing new and are swallowed.
     */
    OPEN_LABEL_DROPPING {
        @Override
        void start(PendingAggregation aggregation) {
            aggregation.getAccumulator().recordInitialLabels(subjectLabels(aggregation.getRepresentative()));
        }

        @Override
        MergeResult merge(PendingAggregation aggregation, GitHubEvent event) {
            if (!sameSubject(aggregation.getRepresentative(), event) || !isLabeled(event.getAction())) {
                return MergeResult.REJECTED;
            }
            Label label = labelOf(event);
            if (label == null || !aggregation.getAccumulator().getInitialLabelIds().contains(label.getId())) {
                return MergeResult.REJECTED;
            }
            return MergeResult.MERGED;
        }
    },

    /**
     * Pairs a demilestoned with a milestoned event (either order) into one
     * {@code x_milestone_changed} notification.
     */
    MILESTONE {
        @Override
        void start(PendingAggregation aggregation) {
            GitHubEvent event = aggregation.getRepresentative();
            if (isMilestoned(event.getAction())) {
                aggregation.getAccumulator().setMilestoneTo(milestoneOf(event));
            } else {
                aggregation.getAccumulator().setMilestoneFrom(milestoneOf(event));
            }
        }

        @Override
        MergeResult merge(PendingAggregation aggregation, GitHubEvent event) {
            if (!sameSubject(aggregation.getRepresentative(), event)) {
                return MergeResult.REJECTED;
            }
            Accumulator accumulator = aggregation.getAccumulator();
            if (accumulator.hasMilestoneFrom() && accumulator.hasMilestoneTo()) {
                return MergeResult.REJECTED;
            }
            Milestone milestone = milestoneOf(event);
            if (isMilestoned(event.getAction()) && !accumulator.hasMilestoneTo()) {
                accumulator.setMilestoneTo(milestone);
            } else if (isDemilestoned(event.getAction()) && !accumulator.hasMilestoneFrom()) {
                accumulator.setMilestoneFrom(milestone);
            } else {
                return MergeResult.REJECTED;
            }
            aggregation.switchAction(milestoneChanged(event.getKind()));
            return MergeResult.MERGED_KEEP_DEADLINE;
        }
    },

    /**
     * Joins "comment and close" (or reopen) clicks into the comment notification.
     * Whichever of the two arrives first starts the aggregation; the comment
     * always ends up as the representative.
     */
    STATE_COMMENT_COUPLING {
        @Override
        void start(PendingAggregation aggregation) {
            // nothing to seed
        }

        @Override
        MergeResult merge(PendingAggregation aggregation, GitHubEvent event) {
            GitHubEvent representative = aggregation.getRepresentative();
            if (!sameIssue(representative, event) || !sameSender(representative, event)) {
                return MergeResult.REJECTED;
            }
            Accumulator accumulator = aggregation.getAccumulator();
            if (representative instanceof IssueCommentEvent && event instanceof IssuesEvent issues) {
                return markState(accumulator, issues.getAction()) ? MergeResult.MERGED : MergeResult.REJECTED;
            }
            if (representative instanceof IssuesEvent issues
                    && event instanceof IssueCommentEvent comment
                    && comment.getAction() == CommentAction.CREATED) {
                if (!markState(accumulator, issues.getAction())) {
                    return MergeResult.REJECTED;
                }
                aggregation.replaceRepresentative(comment, comment.getAction());
                return MergeResult.MERGED;
            }
            return MergeResult.REJECTED;
        }

        private boolean markState(Accumulator accumulator, IssueAction action) {
            if (action == IssueAction.CLOSED) {
                accumulator.markClosed();
                return true;
            }
            if (action == IssueAction.REOPENED) {
                accumulator.markReopened();
                return true;
            }
            return false;
        }
    };

    private static final Map<EventKind, Map<EventAction, AggregationPolicy>> TABLE;

    static {
        Map<EventKind, Map<EventAction, AggregationPolicy>> table = new EnumMap<>(EventKind.class);
        Map<EventAction, AggregationPolicy> issues = new HashMap<>();
        issues.put(IssueAction.OPENED, OPEN_LABEL_DROPPING);
        issues.put(IssueAction.LABELED, LABELS);
        issues.put(IssueAction.UNLABELED, LABELS);
        issues.put(IssueAction.MILESTONED, MILESTONE);
        issues.put(IssueAction.DEMILESTONED, MILESTONE);
        issues.put(IssueAction.CLOSED, STATE_COMMENT_COUPLING);
        issues.put(IssueAction.REOPENED, STATE_COMMENT_COUPLING);
        table.put(EventKind.ISSUES, Collections.unmodifiableMap(issues));

        Map<EventAction, AggregationPolicy> pullRequests = new HashMap<>();
        pullRequests.put(PullRequestAction.OPENED, OPEN_LABEL_DROPPING);
        pullRequests.put(PullRequestAction.LABELED, LABELS);
        pullRequests.put(PullRequestAction.UNLABELED, LABELS);
        pullRequests.put(PullRequestAction.MILESTONED, MILESTONE);
        pullRequests.put(PullRequestAction.DEMILESTONED, MILESTONE);
        table.put(EventKind.PULL_REQUEST, Collections.unmodifiableMap(pullRequests));

        table.put(EventKind.ISSUE_COMMENT, Map.of(CommentAction.CREATED, STATE_COMMENT_COUPLING));
        TABLE = Collections.unmodifiableMap(table);
    }

    /** Seeds the accumulator from the aggregation's first event. */
    abstract void start(PendingAggregation aggregation);

    /** Decides whether {@code event} is folded into {@code aggregation}, updating it if so. */
    abstract MergeResult merge(PendingAggregation aggregation, GitHubEvent event);

    /**
     * Looks up the policy an event of this kind and action starts.
     *
     * @return empty if such events are delivered on their own
     */
    public static Optional<AggregationPolicy> forEvent(EventKind kind, EventAction action) {
        if (kind == null || action == null) {
            return Optional.empty();
        }
        Map<EventAction, AggregationPolicy> byAction = TABLE.get(kind);
        return byAction != null ? Optional.ofNullable(byAction.get(action)) : Optional.empty();
    }

    // ------------------------------------------------------------------
    // Helpers over the issue / pull request variants
    // ------------------------------------------------------------------

    private static boolean sameSubject(GitHubEvent a, GitHubEvent b) {
        return a.getKind() == b.getKind()
                && a.getSubjectNumber() != null
                && a.getSubjectNumber().equals(b.getSubjectNumber());
    }

    /** Issue comments and issue state changes share the issue number. */
    private static boolean sameIssue(GitHubEvent a, GitHubEvent b) {
        return a.getSubjectNumber() != null && a.getSubjectNumber().equals(b.getSubjectNumber());
    }

    private static boolean sameSender(GitHubEvent a, GitHubEvent b) {
        return a.getSenderId() != null && Objects.equals(a.getSenderId(), b.getSenderId());
    }

    private static void applyLabel(Accumulator accumulator, GitHubEvent event) {
        Label label = labelOf(event);
        if (label == null) {
            throw new IllegalStateException(event + " carries no label");
        }
        if (isLabeled(event.getAction())) {
            accumulator.addLabel(label);
        } else {
            accumulator.removeLabel(label);
        }
    }

    private static boolean isLabeled(EventAction action) {
        return action == IssueAction.LABELED || action == PullRequestAction.LABELED;
    }

    private static boolean isUnlabeled(EventAction action) {
        return action == IssueAction.UNLABELED || action == PullRequestAction.UNLABELED;
    }

    private static boolean isMilestoned(EventAction action) {
        return action == IssueAction.MILESTONED || action == PullRequestAction.MILESTONED;
    }

    private static boolean isDemilestoned(EventAction action) {
        return action == IssueAction.DEMILESTONED || action == PullRequestAction.DEMILESTONED;
    }

    private static EventAction labelsChanged(EventKind kind) {
        return kind == EventKind.PULL_REQUEST ? PullRequestAction.LABELS_CHANGED : IssueAction.LABELS_CHANGED;
    }

    private static EventAction milestoneChanged(EventKind kind) {
        return kind == EventKind.PULL_REQUEST ? PullRequestAction.MILESTONE_CHANGED : IssueAction.MILESTONE_CHANGED;
    }

    private static Label labelOf(GitHubEvent event) {
        if (event instanceof IssuesEvent issues) {
            return issues.getLabel();
        }
        if (event instanceof PullRequestEvent pullRequest) {
            return pullRequest.getLabel();
        }
        return null;
    }

    private static Milestone milestoneOf(GitHubEvent event) {
        if (event instanceof IssuesEvent issues) {
            return issues.getMilestone();
        }
        if (event instanceof PullRequestEvent pullRequest) {
            return pullRequest.getMilestone();
        }
        return null;
    }

    private static List<Label> subjectLabels(GitHubEvent event) {
        if (event instanceof IssuesEvent issues && issues.getIssue() != null) {
            return issues.getIssue().getLabels();
        }
        if (event instanceof PullRequestEvent pullRequest && pullRequest.getPullRequest() != null) {
            return pullRequest.getPullRequest().getLabels();
        }
        return List.of();
    }
}
