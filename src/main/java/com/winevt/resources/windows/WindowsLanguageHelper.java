package com.winevt.resources.windows;

import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * Maps Windows language code identifiers (LCIDs) to language tags.
 */
public final class WindowsLanguageHelper {

    private static final Map<Integer, String> LANGUAGE_TAGS = Map.ofEntries(
            entry(0x0401, "ar-SA"),
            entry(0x0402, "bg-BG"),
            entry(0x0403, "ca-ES"),
            entry(0x0404, "zh-TW"),
            entry(0x0405, "cs-CZ"),
            entry(0x0406, "da-DK"),
            entry(0x0407, "de-DE"),
            entry(0x0408, "el-GR"),
            entry(0x0409, "en-US"),
            entry(0x040a, "es-ES_tradnl"),
            entry(0x040b, "fi-FI"),
            entry(0x040c, "fr-FR"),
            entry(0x040d, "he-IL"),
            entry(0x040e, "hu-HU"),
            entry(0x040f, "is-IS"),
            entry(0x0410, "it-IT"),
            entry(0x0411, "ja-JP"),
            entry(0x0412, "ko-KR"),
            entry(0x0413, "nl-NL"),
            entry(0x0414, "nb-NO"),
            entry(0x0415, "pl-PL"),
            entry(0x0416, "pt-BR"),
            entry(0x0417, "rm-CH"),
            entry(0x0418, "ro-RO"),
            entry(0x0419, "ru-RU"),
            entry(0x041a, "hr-HR"),
            entry(0x041b, "sk-SK"),
            entry(0x041c, "sq-AL"),
            entry(0x041d, "sv-SE"),
            entry(0x041e, "th-TH"),
            entry(0x041f, "tr-TR"),
            entry(0x0420, "ur-PK"),
            entry(0x0421, "id-ID"),
            entry(0x0422, "uk-UA"),
            entry(0x0423, "be-BY"),
            entry(0x0424, "sl-SI"),
            entry(0x0425, "et-EE"),
            entry(0x0426, "lv-LV"),
            entry(0x0427, "lt-LT"),
            entry(0x0428, "tg-Cyrl-TJ"),
            entry(0x0429, "fa-IR"),
            entry(0x042a, "vi-VN"),
            entry(0x042b, "hy-AM"),
            entry(0x042c, "az-Latn-AZ"),
            entry(0x042d, "eu-ES"),
            entry(0x042e, "hsb-DE"),
            entry(0x042f, "mk-MK"),
            entry(0x0432, "tn-ZA"),
            entry(0x0434, "xh-ZA"),
            entry(0x0435, "zu-ZA"),
            entry(0x0436, "af-ZA"),
            entry(0x0437, "ka-GE"),
            entry(0x0438, "fo-FO"),
            entry(0x0439, "hi-IN"),
            entry(0x043a, "mt-MT"),
            entry(0x043b, "se-NO"),
            entry(0x043e, "ms-MY"),
            entry(0x043f, "kk-KZ"),
            entry(0x0440, "ky-KG"),
            entry(0x0441, "sw-KE"),
            entry(0x0442, "tk-TM"),
            entry(0x0443, "uz-Latn-UZ"),
            entry(0x0444, "tt-RU"),
            entry(0x0445, "bn-IN"),
            entry(0x0446, "pa-IN"),
            entry(0x0447, "gu-IN"),
            entry(0x0448, "or-IN"),
            entry(0x0449, "ta-IN"),
            entry(0x044a, "te-IN"),
            entry(0x044b, "kn-IN"),
            entry(0x044c, "ml-IN"),
            entry(0x044d, "as-IN"),
            entry(0x044e, "mr-IN"),
            entry(0x044f, "sa-IN"),
            entry(0x0450, "mn-MN"),
            entry(0x0451, "bo-CN"),
            entry(0x0452, "cy-GB"),
            entry(0x0453, "km-KH"),
            entry(0x0454, "lo-LA"),
            entry(0x0456, "gl-ES"),
            entry(0x0457, "kok-IN"),
            entry(0x045a, "syr-SY"),
            entry(0x045b, "si-LK"),
            entry(0x045d, "iu-Cans-CA"),
            entry(0x045e, "am-ET"),
            entry(0x0461, "ne-NP"),
            entry(0x0462, "fy-NL"),
            entry(0x0463, "ps-AF"),
            entry(0x0464, "fil-PH"),
            entry(0x0465, "dv-MV"),
            entry(0x0468, "ha-Latn-NG"),
            entry(0x046a, "yo-NG"),
            entry(0x046b, "quz-BO"),
            entry(0x046c, "nso-ZA"),
            entry(0x046d, "ba-RU"),
            entry(0x046e, "lb-LU"),
            entry(0x046f, "kl-GL"),
            entry(0x0470, "ig-NG"),
            entry(0x0478, "ii-CN"),
            entry(0x047a, "arn-CL"),
            entry(0x047c, "moh-CA"),
            entry(0x047e, "br-FR"),
            entry(0x0480, "ug-CN"),
            entry(0x0481, "mi-NZ"),
            entry(0x0482, "oc-FR"),
            entry(0x0483, "co-FR"),
            entry(0x0484, "gsw-FR"),
            entry(0x0485, "sah-RU"),
            entry(0x0486, "qut-GT"),
            entry(0x0487, "rw-RW"),
            entry(0x0488, "wo-SN"),
            entry(0x048c, "prs-AF"),
            entry(0x0801, "ar-IQ"),
            entry(0x0804, "zh-CN"),
            entry(0x0807, "de-CH"),
            entry(0x0809, "en-GB"),
            entry(0x080a, "es-MX"),
            entry(0x080c, "fr-BE"),
            entry(0x0810, "it-CH"),
            entry(0x0813, "nl-BE"),
            entry(0x0814, "nn-NO"),
            entry(0x0816, "pt-PT"),
            entry(0x081a, "sr-Latn-CS"),
            entry(0x081d, "sv-FI"),
            entry(0x082c, "az-Cyrl-AZ"),
            entry(0x082e, "dsb-DE"),
            entry(0x083b, "se-SE"),
            entry(0x083c, "ga-IE"),
            entry(0x083e, "ms-BN"),
            entry(0x0843, "uz-Cyrl-UZ"),
            entry(0x0845, "bn-BD"),
            entry(0x0850, "mn-Mong-CN"),
            entry(0x085d, "iu-Latn-CA"),
            entry(0x085f, "tzm-Latn-DZ"),
            entry(0x086b, "quz-EC"),
            entry(0x0c01, "ar-EG"),
            entry(0x0c04, "zh-HK"),
            entry(0x0c07, "de-AT"),
            entry(0x0c09, "en-AU"),
            entry(0x0c0a, "es-ES"),
            entry(0x0c0c, "fr-CA"),
            entry(0x0c1a, "sr-Cyrl-CS"),
            entry(0x0c3b, "se-FI"),
            entry(0x0c6b, "quz-PE"),
            entry(0x1001, "ar-LY"),
            entry(0x1004, "zh-SG"),
            entry(0x1007, "de-LU"),
            entry(0x1009, "en-CA"),
            entry(0x100a, "es-GT"),
            entry(0x100c, "fr-CH"),
            entry(0x101a, "hr-BA"),
            entry(0x103b, "smj-NO"),
            entry(0x1401, "ar-DZ"),
            entry(0x1404, "zh-MO"),
            entry(0x1407, "de-LI"),
            entry(0x1409, "en-NZ"),
            entry(0x140a, "es-CR"),
            entry(0x140c, "fr-LU"),
            entry(0x141a, "bs-Latn-BA"),
            entry(0x143b, "smj-SE"),
            entry(0x1801, "ar-MA"),
            entry(0x1809, "en-IE"),
            entry(0x180a, "es-PA"),
            entry(0x180c, "fr-MC"),
            entry(0x181a, "sr-Latn-BA"),
            entry(0x183b, "sma-NO"),
            entry(0x1c01, "ar-TN"),
            entry(0x1c09, "en-ZA"),
            entry(0x1c0a, "es-DO"),
            entry(0x1c1a, "sr-Cyrl-BA"),
            entry(0x1c3b, "sma-SE"),
            entry(0x2001, "ar-OM"),
            entry(0x2009, "en-JM"),
            entry(0x200a, "es-VE"),
            entry(0x201a, "bs-Cyrl-BA"),
            entry(0x203b, "sms-FI"),
            entry(0x2401, "ar-YE"),
            entry(0x2409, "en-029"),
            entry(0x240a, "es-CO"),
            entry(0x241a, "sr-Latn-RS"),
            entry(0x243b, "smn-FI"),
            entry(0x2801, "ar-SY"),
            entry(0x2809, "en-BZ"),
            entry(0x280a, "es-PE"),
            entry(0x281a, "sr-Cyrl-RS"),
            entry(0x2c01, "ar-JO"),
            entry(0x2c09, "en-TT"),
            entry(0x2c0a, "es-AR"),
            entry(0x2c1a, "sr-Latn-ME"),
            entry(0x3001, "ar-LB"),
            entry(0x3009, "en-ZW"),
            entry(0x300a, "es-EC"),
            entry(0x301a, "sr-Cyrl-ME"),
            entry(0x3401, "ar-KW"),
            entry(0x3409, "en-PH"),
            entry(0x340a, "es-CL"),
            entry(0x3801, "ar-AE"),
            entry(0x380a, "es-UY"),
            entry(0x3c01, "ar-BH"),
            entry(0x3c0a, "es-PY"),
            entry(0x4001, "ar-QA"),
            entry(0x4009, "en-IN"),
            entry(0x400a, "es-BO"),
            entry(0x4409, "en-MY"),
            entry(0x440a, "es-SV"),
            entry(0x4809, "en-SG"),
            entry(0x480a, "es-HN"),
            entry(0x4c0a, "es-NI"),
            entry(0x500a, "es-PR"),
            entry(0x540a, "es-US"));

    private WindowsLanguageHelper() {
        // utility class
    }

    /**
     * Retrieves the language tag of an LCID, such as {@code en-US} for 0x0409.
     *
     * @param lcid the language code identifier
     * @return the language tag, or empty if the LCID is not known
     */
    public static Optional<String> getLanguageTagForLcid(int lcid) {
        return Optional.ofNullable(LANGUAGE_TAGS.get(lcid));
    }
}
