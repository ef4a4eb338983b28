package com.taskflow.backend.modules.task.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NotificationRecipientsTest {

    private final UUID creator = UUID.randomUUID();
    private final UUID assignee = UUID.randomUUID();
    private final UUID commenter = UUID.randomUUID();

    @Test
    @DisplayName("status change notifies creator and assignee once each")
    void statusChange_distinctParties() {
        assertThat(NotificationRecipients.statusChange(creator, assignee)).containsExactly(creator, assignee);
    }

    @Test
    @DisplayName("status change collapses creator and assignee when they are the same user")
    void statusChange_sameUser() {
        assertThat(NotificationRecipients.statusChange(creator, creator)).containsExactly(creator);
    }

    @Test
    @DisplayName("status change without assignee notifies only the creator")
    void statusChange_noAssignee() {
        assertThat(NotificationRecipients.statusChange(creator, null)).containsExactly(creator);
    }

    @Test
    @DisplayName("comment notifications skip the commenter")
    void newComment_excludesCommenter() {
        assertThat(NotificationRecipients.newComment(creator, assignee, commenter)).containsExactly(creator, assignee);
        assertThat(NotificationRecipients.newComment(creator, assignee, assignee)).containsExactly(creator);
        assertThat(NotificationRecipients.newComment(creator, creator, creator)).isEmpty();
        assertThat(NotificationRecipients.newComment(creator, null, creator)).isEmpty();
    }

    @Test
    void assignment_onlyAssignee() {
        assertThat(NotificationRecipients.assignment(assignee)).containsExactly(assignee);
    }
}
