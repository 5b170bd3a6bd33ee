package io.intellixity.lingua.examples.web;

import io.intellixity.lingua.core.error.LanguageConfigurationException;
import io.intellixity.lingua.examples.service.TranslationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;

@RestController
@RequestMapping("/api")
public final class LanguageController {
  private final TranslationService translations;

  public LanguageController(TranslationService translations) {
    this.translations = translations;
  }

  public record KeyResponse(String text, String key) {}
  public record TranslationResponse(String language, String text, String translated) {}
  public record SaveResponse(String file) {}

  @GetMapping("/keys")
  public KeyResponse key(@RequestParam("text") String text) {
    return new KeyResponse(text, translations.keyFor(text));
  }

  @GetMapping("/translate")
  public TranslationResponse translate(@RequestParam("text") String text) {
    return new TranslationResponse(translations.language(), text, translations.translate(text));
  }

  @PutMapping("/language/{id}")
  public ResponseEntity<Map<String, Object>> switchLanguage(@PathVariable("id") String id) throws IOException {
    try {
      translations.switchLanguage(id);
    } catch (LanguageConfigurationException e) {
      return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
    return ResponseEntity.ok(translations.screenTexts());
  }

  @GetMapping("/screen")
  public Map<String, Object> screen() {
    return translations.screenTexts();
  }

  @PostMapping("/screen/save")
  public SaveResponse save() throws IOException {
    return new SaveResponse(String.valueOf(translations.saveScreen()));
  }
}
