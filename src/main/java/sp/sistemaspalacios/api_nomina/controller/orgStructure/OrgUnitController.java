package sp.sistemaspalacios.api_nomina.controller.orgStructure;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_nomina.dto.orgStructure.OrgUnitRequests.CreateRequest;
import sp.sistemaspalacios.api_nomina.dto.orgStructure.OrgUnitRequests.MoveRequest;
import sp.sistemaspalacios.api_nomina.dto.orgStructure.OrgUnitView;
import sp.sistemaspalacios.api_nomina.service.orgStructure.OrgUnitService;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/org-units")
public class OrgUnitController {

    private final OrgUnitService orgUnitService;

    public OrgUnitController(OrgUnitService orgUnitService) {
        this.orgUnitService = orgUnitService;
    }

    @GetMapping
    public ResponseEntity<List<OrgUnitView>> tree(@RequestParam Long ownerId) {
        return ResponseEntity.ok(orgUnitService.tree(ownerId).stream()
                .map(OrgUnitView::from)
                .collect(Collectors.toList()));
    }

    @PostMapping
    public ResponseEntity<OrgUnitView> create(@Valid @RequestBody CreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(OrgUnitView.from(orgUnitService.create(request)));
    }

    @PutMapping("/{id}/parent")
    public ResponseEntity<OrgUnitView> move(@PathVariable Long id, @RequestBody MoveRequest request) {
        return ResponseEntity.ok(OrgUnitView.from(orgUnitService.move(id, request.getNewParentId())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OrgUnitView> deactivate(@PathVariable Long id) {
        return ResponseEntity.ok(OrgUnitView.from(orgUnitService.deactivate(id)));
    }
}
