package edu.uconn.imat.entity;

import com.fasterxml.jackson.databind.JsonNode;
import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Type;

/**
 * JPA Entity for the raw.imat_license table.
 */
@Entity
@Table(schema = "raw", name = "imat_license")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SplitLicense {

    @Id
    @Column(columnDefinition = "TEXT")
    private String split;

    @Type(JsonBinaryType.class)
    @Column(nullable = false, columnDefinition = "jsonb")
    private JsonNode license;
}
