package com.neuroassist.stroke.protocol;

/**
 * The four reviewed action protocols. The eligible-ischemic body is the only one with
 * placeholders and they are filled from {@link ThrombolyticAgentConfig} alone.
 */
final class ProtocolTemplates {

    static final String AGENT_NAME = "{agentName}";
    static final String DOSE_MG_PER_KG = "{doseMgPerKg}";
    static final String MAX_DOSE_MG = "{maxDoseMg}";
    static final String BOLUS_PERCENTAGE = "{bolusPercentage}";

    static final String HEMORRHAGIC = """
            SUSPECTED HEMORRHAGIC STROKE - THROMBOLYSIS CONTRAINDICATED

            Do NOT administer any thrombolytic, anticoagulant or antiplatelet agent.

            1. Secure airway, breathing and circulation; elevate the head of the bed to 30 degrees.
            2. Lower blood pressure cautiously toward a systolic target of 140 mmHg; avoid abrupt drops.
            3. Reverse any anticoagulation and correct coagulopathy without delay.
            4. Refer urgently to neurosurgery for evaluation of hematoma evacuation or decompression.
            5. Admit to a stroke or neurocritical care unit with neurological observations every 15 minutes.""";

    static final String ISCHEMIC_ELIGIBLE = """
            ACUTE ISCHEMIC STROKE - ELIGIBLE FOR THROMBOLYSIS

            Administer {agentName} within the 4.5-hour treatment window.

            1. Confirm the time of symptom onset and exclude contraindications using the thrombolysis checklist.
            2. Keep blood pressure below 185/110 mmHg before treatment and below 180/105 mmHg for 24 hours after.
            3. Dose: {agentName} {doseMgPerKg} mg/kg IV, maximum {maxDoseMg} mg. Give {bolusPercentage}% of the total dose as an IV bolus over 1 minute and infuse any remainder over 60 minutes.
            4. Monitor neurological status and blood pressure every 15 minutes during and after treatment.
            5. Withhold antiplatelet and anticoagulant therapy for 24 hours and repeat brain imaging before starting them.""";

    static final String ISCHEMIC_NOT_ELIGIBLE = """
            ACUTE ISCHEMIC STROKE - NOT ELIGIBLE FOR THROMBOLYSIS

            Thrombolysis is not indicated: the patient is outside the 4.5-hour treatment window.

            1. Start aspirin 160-325 mg once hemorrhage has been excluded, unless contraindicated.
            2. Permit blood pressure up to 220/120 mmHg unless another condition requires lowering it.
            3. Keep glucose between 140 and 180 mg/dL, treat fever and maintain euvolemia.
            4. Refer for endovascular thrombectomy assessment if a large-vessel occlusion is suspected.
            5. Admit to a stroke unit for swallow screening, DVT prophylaxis and early rehabilitation.""";

    static final String UNCERTAIN = """
            STROKE TYPE UNCERTAIN - STABILIZE AND INVESTIGATE

            Do not give thrombolytic or antiplatelet therapy until the stroke type is confirmed.

            1. Stabilize airway, breathing and circulation and check capillary glucose.
            2. Obtain an urgent non-contrast CT or MRI of the brain.
            3. Monitor blood pressure and neurological status every 15 minutes.
            4. Reassess in 30 minutes or as soon as imaging is available.
            5. Consult the stroke team for further management.""";

    private ProtocolTemplates() {
    }
}
