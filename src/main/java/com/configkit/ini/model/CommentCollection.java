package com.configkit.ini.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered pre-comments of an element, one {@link Comment} per physical line.
 */
public class CommentCollection extends ArrayList<Comment> {

    private static final long serialVersionUID = 1L;

    /**
     * Joins the comment texts with '\n'.
     */
    public String toMultiLineText() {
        if (isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(size() * 32);
        for (int i = 0; i < size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(get(i).getValue());
        }
        return sb.toString();
    }

    /**
     * Replaces the content with one comment per line of {@code text}, using {@code prefix}.
     * Either every line is accepted or the collection is left untouched.
     */
    public boolean trySetMultiLineText(String text, char prefix) {
        if (text == null || text.isEmpty()) {
            clear();
            return true;
        }

        List<Comment> replacement = new ArrayList<>();
        for (String line : text.split("\r\n|\r|\n", -1)) {
            Comment comment = new Comment(prefix, "");
            if (!comment.trySetValue(line)) {
                return false;
            }
            replacement.add(comment);
        }

        clear();
        addAll(replacement);
        return true;
    }

    public boolean trySetMultiLineText(String text) {
        return trySetMultiLineText(text, Comment.DEFAULT_PREFIX);
    }

    /**
     * Deep copy: every comment is cloned.
     */
    public CommentCollection copy() {
        CommentCollection copy = new CommentCollection();
        for (Comment comment : this) {
            if (comment != null) {
                copy.add(comment.copy());
            }
        }
        return copy;
    }
}
