package edu.uconn.imat.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the raw.imat_label_map table.
 * Reference data: the whole table is replaced on every load.
 */
@Entity
@Table(schema = "raw", name = "imat_label_map")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LabelMapEntry {

    @Id
    @Column(name = "label_id")
    private Integer labelId;

    @Column(name = "task_id", nullable = false)
    private Integer taskId;

    @Column(name = "label_name", nullable = false, columnDefinition = "TEXT")
    private String labelName;

    @Column(name = "task_name", nullable = false, columnDefinition = "TEXT")
    private String taskName;
}
