package sp.sistemaspalacios.api_nomina.entity.workObject;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Apertura de un objeto. Solo puede haber una abierta por objeto:
 * openObjectId vale el id del objeto mientras está abierta y null al cerrarse.
 */
@Entity
@Table(name = "object_openings")
@Data
public class ObjectOpening {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "object_id", nullable = false)
    private WorkObject workObject;

    @Column(name = "open_object_id", unique = true)
    private Long openObjectId;

    @Column(name = "opened_by", nullable = false)
    private Long openedBy;

    @Column(name = "opened_at", nullable = false)
    private LocalDateTime openedAt;

    @Column(name = "open_coordinates")
    private String openCoordinates;

    @Column(name = "closed_by")
    private Long closedBy;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Column(name = "close_coordinates")
    private String closeCoordinates;

    public boolean isOpen() {
        return closedAt == null;
    }
}
