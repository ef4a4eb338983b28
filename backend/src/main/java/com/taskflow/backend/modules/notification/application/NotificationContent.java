package com.taskflow.backend.modules.notification.application;

import com.taskflow.backend.modules.task.domain.TaskStatus;

import org.springframework.web.util.HtmlUtils;

/**
 * In-app text plus the matching email for one task event.
 */
public record NotificationContent(String message, String emailSubject, String emailBody) {

    private static final String FOOTER = "<p>Please sign in to see the task details.</p>";

    public static NotificationContent assignment(String taskTitle, String creatorName) {
        return new NotificationContent(
                "You have been assigned a new task: " + taskTitle + " from " + creatorName,
                "New task assigned",
                html("You have been assigned a new task",
                        row("Title", taskTitle),
                        row("From", creatorName))
        );
    }

    public static NotificationContent statusChange(String taskTitle, TaskStatus status) {
        return new NotificationContent(
                "Task '" + taskTitle + "' " + status.notificationPhrase(),
                "Task status changed: " + taskTitle,
                html("Task status changed",
                        row("Task", taskTitle),
                        row("New status", status.label()))
        );
    }

    public static NotificationContent newComment(String taskTitle, String authorName, String commentText) {
        return new NotificationContent(
                "New comment from " + authorName + " on task '" + taskTitle + "'",
                "New comment on task: " + taskTitle,
                html("New comment on a task",
                        row("Task", taskTitle),
                        row("From", authorName),
                        row("Comment", commentText))
        );
    }

    private static String row(String label, String value) {
        return "<p><strong>" + label + ":</strong> " + HtmlUtils.htmlEscape(value != null ? value : "") + "</p>";
    }

    private static String html(String heading, String... rows) {
        StringBuilder body = new StringBuilder("<html><body><h2>").append(heading).append("</h2>");
        for (String row : rows) {
            body.append(row);
        }
        return body.append(FOOTER).append("</body></html>").toString();
    }
}
