package com.configkit.ini.model;

import lombok.Getter;

/**
 * Common part of sections and properties: a validated, immutable name plus comment metadata.
 */
@Getter
public abstract class ElementBase {

    private final String name;
    private final CommentCollection preComments = new CommentCollection();
    private Comment comment;

    protected ElementBase(String name) {
        validateName(name);
        this.name = name;
    }

    /**
     * Checks the naming rules shared by sections and properties.
     *
     * @throws IllegalArgumentException when the name is blank, padded with whitespace or spans lines
     */
    public static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Element name cannot be empty or whitespace");
        }
        if (Character.isWhitespace(name.charAt(0)) || Character.isWhitespace(name.charAt(name.length() - 1))) {
            throw new IllegalArgumentException("Element name cannot have leading or trailing whitespace");
        }
        if (Comment.containsLineBreak(name)) {
            throw new IllegalArgumentException("Element name cannot contain newline characters");
        }
    }

    public static boolean isValidName(String name) {
        try {
            validateName(name);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public boolean hasComment() {
        return comment != null;
    }

    /**
     * Sets the inline comment. The given instance is stored as is; pass a copy when it is shared.
     */
    public void setComment(Comment comment) {
        this.comment = comment;
    }

    public void setComment(String text) {
        this.comment = text == null ? null : new Comment(text);
    }

    /**
     * Appends text to the inline comment, creating one when absent.
     */
    public void appendComment(Comment other) {
        if (other == null) {
            return;
        }
        this.comment = comment == null
                ? other.copy()
                : new Comment(comment.getPrefix(), comment.getValue() + other.getValue());
    }

    public void addPreComment(Comment comment) {
        preComments.add(comment.copy());
    }

    public void addPreComment(String text) {
        preComments.add(new Comment(text));
    }

    public void addPreComments(Iterable<Comment> comments) {
        for (Comment c : comments) {
            if (c != null) {
                preComments.add(c.copy());
            }
        }
    }

    /**
     * Replaces pre-comments and inline comment with copies of {@code source}'s.
     */
    protected void copyCommentsFrom(ElementBase source) {
        preComments.clear();
        preComments.addAll(source.getPreComments().copy());
        comment = source.getComment() == null ? null : source.getComment().copy();
    }

    protected void clearComments() {
        preComments.clear();
        comment = null;
    }
}
