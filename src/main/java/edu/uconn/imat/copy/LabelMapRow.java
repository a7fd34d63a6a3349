package edu.uconn.imat.copy;

import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Row of {@code raw.imat_label_map}.
 */
@Value
public class LabelMapRow implements CopyRow {

    int labelId;

    int taskId;

    String labelName;

    String taskName;

    @Override
    public List<Object> copyValues() {
        return Arrays.asList(labelId, taskId, labelName, taskName);
    }
}
