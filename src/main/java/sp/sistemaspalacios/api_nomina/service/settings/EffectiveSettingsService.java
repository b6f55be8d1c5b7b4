package sp.sistemaspalacios.api_nomina.service.settings;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_nomina.dto.settings.EffectiveSettings;
import sp.sistemaspalacios.api_nomina.entity.contract.Contract;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;
import sp.sistemaspalacios.api_nomina.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_nomina.repository.contract.ContractRepository;
import sp.sistemaspalacios.api_nomina.repository.workObject.WorkObjectRepository;

/**
 * Consulta de configuración efectiva para mostrar en la web.
 */
@Service
@RequiredArgsConstructor
public class EffectiveSettingsService {

    private final SettingsResolver settingsResolver;
    private final WorkObjectRepository workObjectRepository;
    private final ContractRepository contractRepository;

    @Transactional(readOnly = true)
    public EffectiveSettings effectiveFor(Long contractId, Long objectId) {
        WorkObject object = workObjectRepository.findById(objectId)
                .orElseThrow(() -> new ResourceNotFoundException("Objeto con ID " + objectId + " no encontrado"));
        Contract contract = null;
        if (contractId != null) {
            contract = contractRepository.findById(contractId)
                    .orElseThrow(() -> new ResourceNotFoundException("Contrato con ID " + contractId + " no encontrado"));
        }
        return settingsResolver.resolve(contract, object, object.getOrgUnit());
    }
}
